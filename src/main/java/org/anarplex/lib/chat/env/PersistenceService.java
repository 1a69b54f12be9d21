package org.anarplex.lib.chat.env;

import org.anarplex.lib.chat.utils.DateAndTime;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * The PersistenceService interface provides a simple API for storing the history of every conversation and the
 * metadata of every existing group.  It is designed to be abstract enough to support storage backends other than
 * the JSON files the chat viewer reads.
 * Unlike the in-memory registries, a PersistenceService instance is shared by all client connections and must be
 * safe for concurrent use.  Nothing is cached: every append reads and rewrites the authoritative log.
 * init() will be called at the start of the lifecycle and close() at the end.
 */
public interface PersistenceService extends AutoCloseable {

    // explicitly readies the PersistenceService for use
    void init() throws PersistenceException;

    // indicates no further use of this service's instance
    void close();

    /**
     * append adds the supplied entry to the end of the conversation log identified by key, creating the log if it
     * does not yet exist.  A log that can no longer be decoded is replaced by a fresh one holding just this entry.
     */
    void append(ConversationKey key, ChatEntry entry) throws PersistenceException;

    /**
     * readConversation returns every entry of the conversation in the order they were appended, or an empty list if
     * there is no such conversation.
     *
     * @throws CorruptedLogException if the log exists but cannot be decoded
     */
    List<ChatEntry> readConversation(ConversationKey key) throws PersistenceException;

    /**
     * listConversations returns the keys of all conversation logs present in the store: direct conversations first,
     * then group conversations, each sorted by name.
     */
    List<ConversationKey> listConversations() throws PersistenceException;

    /**
     * writeGroupMetadata overwrites (or creates) the info record of the named group.
     */
    void writeGroupMetadata(GroupInfo groupInfo) throws PersistenceException;

    /**
     * deleteGroupMetadata removes the info record of the named group.  Removing an absent record is not an error.
     */
    void deleteGroupMetadata(String groupName) throws PersistenceException;

    /**
     * readGroupMetadata returns the info record of the named group or null if no such record exists.
     */
    GroupInfo readGroupMetadata(String groupName) throws PersistenceException;


    enum MessageType {
        DIRECT("direct"),
        GROUP("group");

        private final String value;

        MessageType(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        /**
         * Return the MessageType whose value matches the supplied value, or null if no match is found.
         */
        public static MessageType of(String value) {
            for (MessageType t : values()) {
                if (t.value.equals(value)) {
                    return t;
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * One persisted message.  The messageHash is the SHA-256 of the message text.  It lets readers detect accidental
     * corruption of a log, but anybody able to edit the file can recompute it, so it proves nothing about who wrote
     * the entry.
     */
    record ChatEntry(String timestamp, String sender, String receiver, String message, String messageHash,
                     MessageType type) {

        /**
         * Creates an entry stamped with the current time and the digest of the supplied message.
         */
        public static ChatEntry of(String sender, String receiver, String message, MessageType type) {
            return new ChatEntry(DateAndTime.now(), sender, receiver, message, hash(message), type);
        }

        /**
         * isIntact recomputes the digest of the stored message and compares it with the stored digest.
         */
        public boolean isIntact() {
            return message != null && hash(message).equals(messageHash);
        }

        /**
         * Hex encoded SHA-256 digest of the UTF-8 bytes of the supplied text.
         */
        public static String hash(String text) {
            try {
                MessageDigest md = MessageDigest.getInstance("SHA-256");
                return HexFormat.of().formatHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
            } catch (NoSuchAlgorithmException e) {
                // every JRE is required to provide SHA-256
                throw new IllegalStateException(e);
            }
        }
    }

    /**
     * The persisted view of a group, as written to its info file.
     */
    record GroupInfo(String groupName, String admin, List<String> members, String createdDate) {
        public GroupInfo {
            members = (members == null) ? List.of() : List.copyOf(members);
        }
    }

    /**
     * Identifies one conversation log.  A direct conversation is keyed on both participants in ascending order, so
     * that the same log is selected whichever of the two is the sender.  A group conversation is keyed on the group
     * name alone, in which case peer is null.
     */
    record ConversationKey(MessageType type, String name, String peer) {

        public ConversationKey {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
            if (type == MessageType.DIRECT) {
                Objects.requireNonNull(peer, "peer");
                if (name.compareTo(peer) > 0) {
                    String t = name;
                    name = peer;
                    peer = t;
                }
            } else {
                peer = null;
            }
        }

        public static ConversationKey direct(String participant, String otherParticipant) {
            return new ConversationKey(MessageType.DIRECT, participant, otherParticipant);
        }

        public static ConversationKey group(String groupName) {
            return new ConversationKey(MessageType.GROUP, groupName, null);
        }

        public boolean isGroup() {
            return type == MessageType.GROUP;
        }

        @Override
        public String toString() {
            return isGroup() ? "#" + name : name + "/" + peer;
        }
    }

    class PersistenceException extends Exception {
        public PersistenceException(String message) {
            super(message);
        }

        public PersistenceException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    class CorruptedLogException extends PersistenceException {
        public CorruptedLogException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
