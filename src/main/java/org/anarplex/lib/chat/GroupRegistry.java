package org.anarplex.lib.chat;

import org.anarplex.lib.chat.env.PersistenceService;
import org.anarplex.lib.chat.env.PersistenceService.GroupInfo;
import org.anarplex.lib.chat.utils.DateAndTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the membership and admin of every named group.  A group always has at least one member and its admin is
 * always one of them; a group whose last member leaves is deleted together with its metadata file.
 * Every operation is atomic with respect to group state: the state is changed and its metadata rewritten while holding
 * the registry's monitor.  Notifications to the users concerned are sent after the monitor is released.
 */
public class GroupRegistry {

    private static final Logger logger = LoggerFactory.getLogger(GroupRegistry.class);

    private final SessionRegistry sessionRegistry;
    private final PersistenceService persistenceService;

    // creation ordered, so /listgroups is stable
    private final Map<String, Group> groups = new LinkedHashMap<>();

    public GroupRegistry(SessionRegistry sessionRegistry, PersistenceService persistenceService) {
        this.sessionRegistry = sessionRegistry;
        this.persistenceService = persistenceService;
    }

    /**
     * Creates the named group with the supplied user as its admin and only member.
     */
    public GroupInfo create(String admin, String name) throws GroupException {
        GroupInfo info;
        synchronized (this) {
            if (groups.containsKey(name)) {
                throw new ExistingGroupException("Group '" + name + "' already exists");
            }
            Group group = new Group(name, admin, LocalDateTime.now());
            groups.put(name, group);
            info = group.toInfo();
            saveMetadata(info);
        }
        logger.info("Group {} created by {}", name, admin);
        return info;
    }

    /**
     * Adds an online user to the named group.  Only the group's admin may do so.  The added user is told directly,
     * and every online member (the added one included) receives a notice in the group.
     */
    public GroupInfo addMember(String requester, String name, String user) throws GroupException {
        GroupInfo info;
        synchronized (this) {
            Group group = groups.get(name);
            if (group == null) {
                throw new NoSuchGroupException("Group '" + name + "' does not exist");
            }
            if (!group.admin.equals(requester)) {
                throw new NotAdminException("Only the admin can add members to '" + name + "'");
            }
            if (!sessionRegistry.isActive(user)) {
                throw new UserOfflineException("User '" + user + "' is not online");
            }
            if (group.members.contains(user)) {
                throw new AlreadyMemberException("User '" + user + "' is already in the group");
            }
            group.members.add(user);
            info = group.toInfo();
            saveMetadata(info);
        }
        logger.info("{} added to group {} by {}", user, name, requester);

        notifyUser(user, "You have been added to group '" + name + "' by " + requester);
        sendNotice(info, user + " has been added to the group by " + requester);
        return info;
    }

    /**
     * Removes the supplied user from the named group.  When the admin leaves, the longest standing remaining member
     * becomes admin and is told so.  When the last member leaves, the group is deleted.
     *
     * @return the group after the departure, or null if the departure deleted the group
     */
    public GroupInfo leave(String user, String name) throws GroupException {
        GroupInfo info;
        String newAdmin = null;
        synchronized (this) {
            Group group = groups.get(name);
            if (group == null) {
                throw new NoSuchGroupException("Group '" + name + "' does not exist");
            }
            if (!group.members.remove(user)) {
                throw new NotMemberException("You are not a member of group '" + name + "'");
            }
            if (group.members.isEmpty()) {
                groups.remove(name);
                deleteMetadata(name);
                info = null;
            } else {
                if (group.admin.equals(user)) {
                    // members are kept in the order they joined
                    newAdmin = group.members.iterator().next();
                    group.admin = newAdmin;
                }
                info = group.toInfo();
                saveMetadata(info);
            }
        }

        if (info == null) {
            logger.info("Group {} deleted after {} left", name, user);
            return null;
        }
        logger.info("{} left group {}", user, name);
        if (newAdmin != null) {
            logger.info("{} is now admin of group {}", newAdmin, name);
            notifyUser(newAdmin, "You are now the admin of group '" + name + "'");
        }
        sendNotice(info, user + " has left the group");
        return info;
    }

    /**
     * Returns the groups the supplied user is a member of, in creation order.
     */
    public synchronized List<GroupInfo> listForUser(String user) {
        List<GroupInfo> result = new ArrayList<>();
        for (Group group : groups.values()) {
            if (group.members.contains(user)) {
                result.add(group.toInfo());
            }
        }
        return result;
    }

    /**
     * Returns the named group as seen by one of its members.
     */
    public synchronized GroupInfo listMembers(String requester, String name) throws GroupException {
        Group group = groups.get(name);
        if (group == null) {
            throw new NoSuchGroupException("Group '" + name + "' does not exist");
        }
        if (!group.members.contains(requester)) {
            throw new NotMemberException("You are not a member of group '" + name + "'");
        }
        return group.toInfo();
    }

    /**
     * Sends a system line, formatted as "[group] text", to every online member of the group.  Not persisted.
     *
     * @return the number of members the notice was delivered to
     */
    int sendNotice(GroupInfo group, String text) {
        return deliver(group.members(), Protocol.groupNotice(group.groupName(), text));
    }

    private void notifyUser(String user, String line) {
        deliver(List.of(user), line);
    }

    private int deliver(Collection<String> recipients, String line) {
        int delivered = 0;
        for (String recipient : recipients) {
            Session session = sessionRegistry.lookup(recipient);
            if (session != null) {
                if (session.send(line)) {
                    delivered++;
                } else {
                    logger.debug("Could not deliver notice to {}", recipient);
                }
            }
        }
        return delivered;
    }

    // metadata failures are not the requester's problem.  the in-memory state stays authoritative
    private void saveMetadata(GroupInfo info) {
        try {
            persistenceService.writeGroupMetadata(info);
        } catch (PersistenceService.PersistenceException e) {
            logger.error("Unable to save metadata of group {}: {}", info.groupName(), e.getMessage(), e);
        }
    }

    private void deleteMetadata(String name) {
        try {
            persistenceService.deleteGroupMetadata(name);
        } catch (PersistenceService.PersistenceException e) {
            logger.error("Unable to delete metadata of group {}: {}", name, e.getMessage(), e);
        }
    }

    private static class Group {
        private final String name;
        private final Set<String> members = new LinkedHashSet<>();
        private String admin;
        private final LocalDateTime createdAt;

        Group(String name, String admin, LocalDateTime createdAt) {
            this.name = name;
            this.admin = admin;
            this.createdAt = createdAt;
            members.add(admin);
        }

        GroupInfo toInfo() {
            return new GroupInfo(name, admin, new ArrayList<>(members), DateAndTime.format(createdAt));
        }
    }

    /**
     * Base of every rejected group operation.  The message is the reply sent to the requesting user.
     */
    public abstract static class GroupException extends Exception {
        protected GroupException(String message) {
            super(message);
        }
    }

    public static class ExistingGroupException extends GroupException {
        public ExistingGroupException(String message) {
            super(message);
        }
    }

    public static class NoSuchGroupException extends GroupException {
        public NoSuchGroupException(String message) {
            super(message);
        }
    }

    public static class NotAdminException extends GroupException {
        public NotAdminException(String message) {
            super(message);
        }
    }

    public static class NotMemberException extends GroupException {
        public NotMemberException(String message) {
            super(message);
        }
    }

    public static class UserOfflineException extends GroupException {
        public UserOfflineException(String message) {
            super(message);
        }
    }

    public static class AlreadyMemberException extends GroupException {
        public AlreadyMemberException(String message) {
            super(message);
        }
    }
}
