package org.anarplex.lib.chat;

import org.anarplex.lib.chat.env.PersistenceService;
import org.anarplex.lib.chat.env.PersistenceService.ChatEntry;
import org.anarplex.lib.chat.env.PersistenceService.ConversationKey;
import org.anarplex.lib.chat.env.PersistenceService.GroupInfo;
import org.anarplex.lib.chat.env.PersistenceService.MessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers public, private and group messages to the online users they are addressed to and writes each delivered
 * message through to the conversation logs.
 * Delivery is best effort: every recipient is tried once, and a recipient whose connection fails is skipped without
 * affecting the others.  Such a recipient's own read loop notices the broken connection and ends its session.
 */
public class MessageRouter {

    private static final Logger logger = LoggerFactory.getLogger(MessageRouter.class);

    private final SessionRegistry sessionRegistry;
    private final GroupRegistry groupRegistry;
    private final PersistenceService persistenceService;

    public static class UserNotFoundException extends Exception {
        public UserNotFoundException(String message) {
            super(message);
        }
    }

    public MessageRouter(SessionRegistry sessionRegistry, GroupRegistry groupRegistry, PersistenceService persistenceService) {
        this.sessionRegistry = sessionRegistry;
        this.groupRegistry = groupRegistry;
        this.persistenceService = persistenceService;
    }

    /**
     * Sends "sender: text" to every online user but the sender, and logs one direct entry in the conversation of the
     * sender with each user it was delivered to.
     *
     * @return the number of users the message was delivered to
     */
    public int broadcastPublic(Session sender, String text) {
        String line = Protocol.publicMessage(sender.getName(), text);
        int delivered = 0;
        for (Session recipient : sessionRegistry.sessions()) {
            if (recipient == sender) {
                continue;
            }
            if (recipient.send(line)) {
                delivered++;
                record(ConversationKey.direct(sender.getName(), recipient.getName()),
                        ChatEntry.of(sender.getName(), recipient.getName(), text, MessageType.DIRECT));
            } else {
                logger.warn("Public message from {} not delivered to {}", sender.getName(), recipient.getName());
            }
        }
        logger.debug("Public message from {} delivered to {} users", sender.getName(), delivered);
        return delivered;
    }

    /**
     * Sends "[Private] sender: text" to the target and "[Private to target]: text" back to the sender, and logs
     * the message in their direct conversation.  If the target's connection fails, the sender is told instead and
     * nothing is logged.
     *
     * @return true if the message was delivered to the target
     * @throws UserNotFoundException if the target is not online
     */
    public boolean sendPrivate(Session sender, String target, String text) throws UserNotFoundException {
        Session recipient = sessionRegistry.lookup(target);
        if (recipient == null) {
            throw new UserNotFoundException("Error: User " + target + " not found");
        }
        if (!recipient.send(Protocol.privateMessage(sender.getName(), text))) {
            logger.warn("Private message from {} not delivered to {}", sender.getName(), target);
            sender.send("Error: Could not send message to " + target);
            return false;
        }
        sender.send(Protocol.privateConfirmation(target, text));
        record(ConversationKey.direct(sender.getName(), target),
                ChatEntry.of(sender.getName(), target, text, MessageType.DIRECT));
        return true;
    }

    /**
     * Sends "[group] sender: text" to every online member of the group except the sender, and logs one group entry.
     * The sender's own copy of the line is the caller's business.
     *
     * @return the number of members the message was delivered to
     * @throws GroupRegistry.NoSuchGroupException if there is no such group
     * @throws GroupRegistry.NotMemberException   if the sender does not belong to the group
     */
    public int sendGroup(String sender, String group, String text) throws GroupRegistry.GroupException {
        GroupInfo info = groupRegistry.listMembers(sender, group);
        String line = Protocol.groupMessage(group, sender, text);
        int delivered = 0;
        for (String member : info.members()) {
            if (member.equals(sender)) {
                continue;
            }
            Session recipient = sessionRegistry.lookup(member);
            if (recipient == null) {
                continue;   // offline members simply miss the message
            }
            if (recipient.send(line)) {
                delivered++;
            } else {
                logger.warn("Group message from {} to {} not delivered to {}", sender, group, member);
            }
        }
        record(ConversationKey.group(group), ChatEntry.of(sender, group, text, MessageType.GROUP));
        logger.debug("Group message from {} delivered to {} members of {}", sender, delivered, group);
        return delivered;
    }

    /**
     * Sends a line to every online user except the supplied one (which may be null).  Used for the join and leave
     * announcements, which are not logged.
     */
    public int announce(String line, Session except) {
        int delivered = 0;
        for (Session recipient : sessionRegistry.sessions()) {
            if (recipient != except && recipient.send(line)) {
                delivered++;
            }
        }
        return delivered;
    }

    private void record(ConversationKey key, ChatEntry entry) {
        try {
            persistenceService.append(key, entry);
        } catch (PersistenceService.PersistenceException e) {
            logger.error("Unable to log message from {} in {}: {}", entry.sender(), key, e.getMessage(), e);
        }
    }
}
