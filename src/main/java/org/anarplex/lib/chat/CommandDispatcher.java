package org.anarplex.lib.chat;

import org.anarplex.lib.chat.Protocol.Chat_Request_Commands;
import org.anarplex.lib.chat.env.PersistenceService.GroupInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * CommandDispatcher maintains an internal map of Chat_Request_Commands to their respective handlers and applies the
 * matching handler to each request line of an active session.  A line that is no command is a public message.
 * Every rejected request is answered with exactly one line to its sender and never ends the session.
 * A dispatcher holds no per-connection state and is shared by all Protocol Engines.
 */
public class CommandDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    private final SessionRegistry sessionRegistry;
    private final GroupRegistry groupRegistry;
    private final MessageRouter messageRouter;
    private final EnumMap<Chat_Request_Commands, Function<ClientContext, Boolean>> commandHandlers = new EnumMap<>(Chat_Request_Commands.class);

    public CommandDispatcher(SessionRegistry sessionRegistry, GroupRegistry groupRegistry, MessageRouter messageRouter) {
        this.sessionRegistry = sessionRegistry;
        this.groupRegistry = groupRegistry;
        this.messageRouter = messageRouter;
        setCommandHandlers();
    }

    private void setCommandHandlers() {
        commandHandlers.put(Chat_Request_Commands.QUIT, this::handleQuit);
        commandHandlers.put(Chat_Request_Commands.HELP, this::handleHelp);
        commandHandlers.put(Chat_Request_Commands.USERS, this::handleUsers);
        commandHandlers.put(Chat_Request_Commands.CREATE_GROUP, this::handleCreateGroup);
        commandHandlers.put(Chat_Request_Commands.ADD_TO_GROUP, this::handleAddToGroup);
        commandHandlers.put(Chat_Request_Commands.LEAVE_GROUP, this::handleLeaveGroup);
        commandHandlers.put(Chat_Request_Commands.LIST_GROUPS, this::handleListGroups);
        commandHandlers.put(Chat_Request_Commands.GROUP_MEMBERS, this::handleGroupMembers);
        commandHandlers.put(Chat_Request_Commands.PRIVATE_MESSAGE, this::handlePrivateMessage);
        commandHandlers.put(Chat_Request_Commands.GROUP_MESSAGE, this::handleGroupMessage);
    }

    /**
     * Returns the commands this dispatcher has handlers for.
     */
    Set<Chat_Request_Commands> getHandlerNames() {
        return commandHandlers.keySet();
    }

    /**
     * Classifies the supplied request line and executes it on behalf of the context's session.
     *
     * @return false if the session's own connection failed while replying, true otherwise
     */
    public boolean dispatch(ClientContext c, String requestLine) {
        Chat_Request_Commands command = Chat_Request_Commands.getCommand(requestLine);
        if (command == null) {
            if (Chat_Request_Commands.isSlashCommand(requestLine)) {
                logger.debug("Unknown command from {}: {}", c.session.getName(), requestLine);
                return reply(c, Protocol.unknownCommand(requestLine));
            }
            return handlePublicMessage(c, requestLine);
        }
        Function<ClientContext, Boolean> handler = commandHandlers.get(command);
        if (handler == null) {
            return reply(c, Protocol.unknownCommand(requestLine));
        }
        c.command = command;
        c.requestArgs = requestLine.substring(command.getValue().length());
        return handler.apply(c);
    }

    /*
     * --- Beginning of Command Handlers ---
     */

    protected boolean handleQuit(ClientContext c) {
        c.setTerminated();
        return true;
    }

    protected boolean handleHelp(ClientContext c) {
        return c.session.send(Protocol.welcome(c.session.getName()));
    }

    protected boolean handleUsers(ClientContext c) {
        return reply(c, Protocol.onlineUsers(sessionRegistry.names()));
    }

    protected boolean handleCreateGroup(ClientContext c) {
        String requestedName = c.requestArgs.strip();
        if (requestedName.isEmpty()) {
            return reply(c, Protocol.usage(c.command));
        }
        try {
            Protocol.GroupName groupName = new Protocol.GroupName(requestedName);
            groupRegistry.create(c.session.getName(), groupName.getValue());
            return reply(c, "Group '" + groupName + "' created successfully. You are the admin.");
        } catch (Protocol.GroupName.InvalidNameException | GroupRegistry.GroupException e) {
            return reply(c, e.getMessage());
        }
    }

    protected boolean handleAddToGroup(ClientContext c) {
        String[] args = c.requestArgs.strip().split("\\s+", 2);
        if (args.length != 2) {
            return reply(c, Protocol.usage(c.command));
        }
        String groupName = args[0];
        String user = args[1].strip();
        try {
            groupRegistry.addMember(c.session.getName(), groupName, user);
            return reply(c, "User '" + user + "' added to group '" + groupName + "'");
        } catch (GroupRegistry.GroupException e) {
            return reply(c, e.getMessage());
        }
    }

    protected boolean handleLeaveGroup(ClientContext c) {
        String groupName = c.requestArgs.strip();
        if (groupName.isEmpty()) {
            return reply(c, Protocol.usage(c.command));
        }
        try {
            GroupInfo remaining = groupRegistry.leave(c.session.getName(), groupName);
            if (remaining == null) {
                return reply(c, "Left group '" + groupName + "'. Group was deleted as it became empty.");
            }
            return reply(c, "Left group '" + groupName + "'");
        } catch (GroupRegistry.GroupException e) {
            return reply(c, e.getMessage());
        }
    }

    protected boolean handleListGroups(ClientContext c) {
        List<GroupInfo> groups = groupRegistry.listForUser(c.session.getName());
        if (groups.isEmpty()) {
            return reply(c, "You are not a member of any groups");
        }
        List<String> lines = new ArrayList<>();
        lines.add("Your groups:");
        for (GroupInfo g : groups) {
            lines.add(g.groupName() + " (Admin: " + g.admin() + ", Members: " + g.members().size() + ")");
        }
        return c.session.send(lines);
    }

    protected boolean handleGroupMembers(ClientContext c) {
        String groupName = c.requestArgs.strip();
        if (groupName.isEmpty()) {
            return reply(c, Protocol.usage(c.command));
        }
        try {
            GroupInfo group = groupRegistry.listMembers(c.session.getName(), groupName);
            List<String> lines = new ArrayList<>();
            lines.add("Members of '" + groupName + "':");
            for (String member : group.members()) {
                lines.add(member.equals(group.admin()) ? member + " (Admin)" : member);
            }
            return c.session.send(lines);
        } catch (GroupRegistry.GroupException e) {
            return reply(c, e.getMessage());
        }
    }

    protected boolean handlePrivateMessage(ClientContext c) {
        String[] args = splitAddressedMessage(c.requestArgs);
        if (args == null) {
            return reply(c, Protocol.usage(c.command));
        }
        try {
            messageRouter.sendPrivate(c.session, args[0], args[1]);
            return true;
        } catch (MessageRouter.UserNotFoundException e) {
            return reply(c, e.getMessage());
        }
    }

    protected boolean handleGroupMessage(ClientContext c) {
        String[] args = splitAddressedMessage(c.requestArgs);
        if (args == null) {
            return reply(c, Protocol.usage(c.command));
        }
        try {
            messageRouter.sendGroup(c.session.getName(), args[0], args[1]);
            // the sender's copy of its own group message
            return reply(c, Protocol.groupMessage(args[0], c.session.getName(), args[1]));
        } catch (GroupRegistry.GroupException e) {
            return reply(c, e.getMessage());
        }
    }

    protected boolean handlePublicMessage(ClientContext c, String text) {
        messageRouter.broadcastPublic(c.session, text);
        return true;
    }

    /*
     * --- End of Command Handlers ---
     */

    /**
     * Splits "name text" (what follows the @ or # sigil) into the addressee and the message.
     *
     * @return the two parts, or null if either is missing
     */
    private static String[] splitAddressedMessage(String args) {
        String[] parts = args.split(" ", 2);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isBlank()) {
            return null;
        }
        return parts;
    }

    private static boolean reply(ClientContext c, String line) {
        return c.session.send(line);
    }

    /**
     * Every active connection is given its own context object, created once its session is registered.
     */
    public static class ClientContext {

        public ClientContext(Session session) {
            this.session = session;
        }

        protected void setTerminated() {
            isTerminated = true;
        }

        public boolean isTerminated() {
            return isTerminated;
        }

        private final Session session;

        // the command being executed and whatever followed its keyword on the request line
        private Chat_Request_Commands command;
        private String requestArgs;

        // set by /quit
        private boolean isTerminated = false;
    }
}
