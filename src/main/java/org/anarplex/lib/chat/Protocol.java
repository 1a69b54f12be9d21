package org.anarplex.lib.chat;

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Wire level constants of the chat protocol shared with the GUI client: the command grammar, the fixed prompts and
 * the formats of every line the server sends.
 * Every message in either direction is a single line terminated by LF.  A reply spanning several lines is sent as
 * several consecutive lines.
 */
public class Protocol {

    private Protocol() {
        super();
    }

    public static final String LF = "\n";

    public static final String USERNAME_PROMPT = "Enter your username: ";
    public static final String NAME_TAKEN = "Username already taken. Please try again.";
    public static final String INVALID_NAME = "Invalid username. Use up to 64 characters without spaces, '/', '\\' or '_'.";

    // longest request line accepted, terminator excluded
    public static final int MAX_LINE_LENGTH = 4096;
    public static final String LINE_TOO_LONG = "Error: Message too long. Lines are limited to " + MAX_LINE_LENGTH + " characters.";

    /*
     * Commands sent by a client once its session is active:
     * /quit                         ends the session
     * /help                         repeats the command summary
     * /users                        lists the online users
     * /creategroup group            creates a group administered by the sender
     * /addtogroup group user        adds an online user to a group (admin only)
     * /leavegroup group             leaves a group
     * /listgroups                   lists the groups the sender belongs to
     * /groupmembers group           lists the members of a group the sender belongs to
     * @user text                    private message
     * #group text                   group message
     * anything else                 public message
     */
    public enum Chat_Request_Commands {
        QUIT("/quit", false, "/quit"),
        HELP("/help", false, "/help"),
        USERS("/users", false, "/users"),
        CREATE_GROUP("/creategroup", false, "/creategroup groupname"),
        ADD_TO_GROUP("/addtogroup", false, "/addtogroup groupname username"),
        LEAVE_GROUP("/leavegroup", false, "/leavegroup groupname"),
        LIST_GROUPS("/listgroups", false, "/listgroups"),
        GROUP_MEMBERS("/groupmembers", false, "/groupmembers groupname"),
        PRIVATE_MESSAGE("@", true, "@username message"),
        GROUP_MESSAGE("#", true, "#groupname message");

        Chat_Request_Commands(String value, boolean prefix, String usage) {
            this.value = value;
            this.prefix = prefix;
            this.usage = usage;
        }

        /**
         * Return the Command that the supplied request line invokes, or null if the line is not a command (i.e. it is
         * a public message, or an unknown slash command).
         * The candidates are tried longest first.  A slash command matches only as a whole word, so "/users" and
         * "/users x" are USERS but "/usersx" is not; the sigil commands (@, #) match any line they begin.
         */
        public static Chat_Request_Commands getCommand(String line) {
            if (line == null) {
                return null;
            }
            for (Chat_Request_Commands command : sortedValues) {
                if (command.prefix) {
                    if (line.startsWith(command.value)) {
                        return command;
                    }
                } else if (line.equals(command.value) || line.startsWith(command.value + " ")) {
                    return command;
                }
            }
            return null;
        }

        /**
         * Whether the supplied line looks like a slash command, known or not.
         */
        public static boolean isSlashCommand(String line) {
            return line != null && line.startsWith("/");
        }

        public String getValue() { return value; }
        public String getUsage() { return usage; }
        public String toString() { return getValue(); }

        // sorted once at class load time, longest value first
        private static final Chat_Request_Commands[] sortedValues;
        static {
            sortedValues = Arrays.stream(Chat_Request_Commands.values())
                    .sorted(Comparator.comparingInt((Chat_Request_Commands c) -> c.getValue().length()).reversed())
                    .toArray(Chat_Request_Commands[]::new);
        }

        private final String value;
        private final boolean prefix;
        private final String usage;
    }

    /*
     * --- formats of the lines sent by the server ---
     */

    public static String publicMessage(String sender, String text) {
        return sender + ": " + text;
    }

    public static String privateMessage(String sender, String text) {
        return "[Private] " + sender + ": " + text;
    }

    public static String privateConfirmation(String target, String text) {
        return "[Private to " + target + "]: " + text;
    }

    public static String groupMessage(String group, String sender, String text) {
        return "[" + group + "] " + sender + ": " + text;
    }

    public static String groupNotice(String group, String text) {
        return "[" + group + "] " + text;
    }

    public static String joined(String name) {
        return name + " has joined the chat";
    }

    public static String left(String name) {
        return name + " has left the chat";
    }

    public static String onlineUsers(List<String> names) {
        return "Online users: " + String.join(", ", names);
    }

    public static String usage(Chat_Request_Commands command) {
        return switch (command) {
            case PRIVATE_MESSAGE -> "Invalid private message format. Use: " + command.getUsage();
            case GROUP_MESSAGE -> "Invalid group message format. Use: " + command.getUsage();
            default -> "Usage: " + command.getUsage();
        };
    }

    public static String unknownCommand(String line) {
        String word = line.split("\\s+", 2)[0];
        return "Invalid command: " + word + ". Type /help for the list of commands.";
    }

    /**
     * The help text sent after a successful login and in reply to /help.
     */
    public static List<String> welcome(String name) {
        return List.of(
                "Welcome to the chat, " + name + "!",
                "Commands:",
                "- Type normally for public messages",
                "- Use @username message for private messages",
                "- Use #groupname message for group messages",
                "- /creategroup groupname - Create a new group",
                "- /addtogroup groupname username - Add user to group (admin only)",
                "- /leavegroup groupname - Leave a group",
                "- /listgroups - List your groups",
                "- /groupmembers groupname - List group members",
                "- /users - See online users",
                "- /help - Show this list again",
                "- /quit - Leave chat");
    }

    /**
     * A display name identifies one session.  Besides being unique among the online users, it must be usable as part
     * of a file name and as a single word of a command: 1 to 64 characters, no whitespace, no control characters, no
     * path separators, and no leading /, @ or #.
     * The underscore separates the two participants in a conversation log's file name, so it is not allowed either.
     */
    public static class DisplayName {
        private static final int MaxLen = 64;
        private final String name;

        public static class InvalidNameException extends Exception {
            public InvalidNameException(String message) {
                super(message);
            }
        }

        public DisplayName(String name) throws InvalidNameException {
            if (isValid(name)) {
                this.name = name;
            } else {
                throw new InvalidNameException("Invalid username: " + name);
            }
        }

        public String getValue() {
            return name;
        }

        public static boolean isValid(String name) {
            return isUsableWord(name, MaxLen) && !name.contains("_");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A group name follows the display name rules, except that underscores are allowed.
     */
    public static class GroupName {
        private static final int MaxLen = 64;
        private final String name;

        public static class InvalidNameException extends Exception {
            public InvalidNameException(String message) {
                super(message);
            }
        }

        public GroupName(String name) throws InvalidNameException {
            if (isValid(name)) {
                this.name = name;
            } else {
                throw new InvalidNameException("Invalid group name: " + name);
            }
        }

        public String getValue() {
            return name;
        }

        public static boolean isValid(String name) {
            return isUsableWord(name, MaxLen);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    private static boolean isUsableWord(String word, int maxLen) {
        return word != null
                && !word.isEmpty()
                && word.length() <= maxLen
                && !StringUtils.containsWhitespace(word)
                && word.codePoints().noneMatch(Character::isISOControl)
                && !StringUtils.containsAny(word, '/', '\\')        // must stay inside the log directory
                && !StringUtils.equalsAny(word, ".", "..")
                && !StringUtils.startsWithAny(word, "@", "#");      // would be read as a message sigil
    }
}
