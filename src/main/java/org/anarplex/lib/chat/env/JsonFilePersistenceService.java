package org.anarplex.lib.chat.env;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Stores every conversation as a pretty printed JSON array of entries, and every group's metadata as a JSON object,
 * using the file layout shared with the chat viewer:
 * <pre>
 *   &lt;logDir&gt;/&lt;a&gt;_&lt;b&gt;_conversation.json   direct conversation between a and b (a &lt; b)
 *   &lt;logDir&gt;/groups/&lt;g&gt;_group.json         group conversation
 *   &lt;logDir&gt;/groups/&lt;g&gt;_info.json          group metadata
 * </pre>
 * Writers of the same file are serialised, and every rewrite goes to a temporary file that then replaces the
 * original, so a reader never observes a half written log.
 */
public class JsonFilePersistenceService implements PersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(JsonFilePersistenceService.class);

    public static final String GROUPS_DIR = "groups";
    public static final String CONVERSATION_SUFFIX = "_conversation.json";
    public static final String GROUP_LOG_SUFFIX = "_group.json";
    public static final String GROUP_INFO_SUFFIX = "_info.json";
    private static final String PAIR_SEPARATOR = "_";

    private static final Type ENTRY_LIST_TYPE = new TypeToken<List<ChatEntry>>() {}.getType();

    private final Path logDir;
    private final Path groupsDir;
    private final Gson gson;

    // one monitor per file, so unrelated conversations are written concurrently
    private final ConcurrentHashMap<Path, Object> fileLocks = new ConcurrentHashMap<>();

    public JsonFilePersistenceService(Path logDir) {
        this.logDir = logDir;
        this.groupsDir = logDir.resolve(GROUPS_DIR);
        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .disableHtmlEscaping()
                .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)   // message_hash, group_name, ...
                .registerTypeAdapter(MessageType.class, new MessageTypeAdapter())
                .create();
    }

    @Override
    public void init() throws PersistenceException {
        try {
            Files.createDirectories(groupsDir);
        } catch (IOException e) {
            throw new PersistenceException("Unable to create log directory " + groupsDir, e);
        }
        logger.info("Chat logs are stored under {}", logDir.toAbsolutePath());
    }

    // the file locks outlive close(): a connection thread may still be appending
    @Override
    public void close() {
        logger.debug("Closed chat log store {}", logDir.toAbsolutePath());
    }

    @Override
    public void append(ConversationKey key, ChatEntry entry) throws PersistenceException {
        Path file = logFile(key);
        synchronized (lockFor(file)) {
            List<ChatEntry> history;
            try {
                history = readEntries(file);
            } catch (CorruptedLogException e) {
                logger.warn("Conversation log {} is corrupted, starting a new one: {}", file, e.getMessage());
                history = new ArrayList<>();
            }
            history.add(entry);
            writeAtomically(file, gson.toJson(history, ENTRY_LIST_TYPE));
        }
        logger.debug("Appended {} entry from {} to {}", entry.type(), entry.sender(), key);
    }

    @Override
    public List<ChatEntry> readConversation(ConversationKey key) throws PersistenceException {
        Path file = logFile(key);
        synchronized (lockFor(file)) {
            return readEntries(file);
        }
    }

    @Override
    public List<ConversationKey> listConversations() throws PersistenceException {
        List<ConversationKey> keys = new ArrayList<>();
        for (String fileName : listFileNames(logDir, CONVERSATION_SUFFIX)) {
            String pair = fileName.substring(0, fileName.length() - CONVERSATION_SUFFIX.length());
            int separator = pair.indexOf(PAIR_SEPARATOR);
            if (separator > 0 && separator < pair.length() - 1) {
                keys.add(ConversationKey.direct(pair.substring(0, separator), pair.substring(separator + 1)));
            } else {
                logger.warn("Ignoring conversation log with unexpected name: {}", fileName);
            }
        }
        for (String fileName : listFileNames(groupsDir, GROUP_LOG_SUFFIX)) {
            keys.add(ConversationKey.group(fileName.substring(0, fileName.length() - GROUP_LOG_SUFFIX.length())));
        }
        return keys;
    }

    @Override
    public void writeGroupMetadata(GroupInfo groupInfo) throws PersistenceException {
        Path file = infoFile(groupInfo.groupName());
        synchronized (lockFor(file)) {
            writeAtomically(file, gson.toJson(groupInfo));
        }
    }

    @Override
    public void deleteGroupMetadata(String groupName) throws PersistenceException {
        Path file = infoFile(groupName);
        synchronized (lockFor(file)) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new PersistenceException("Unable to delete " + file, e);
            }
        }
    }

    @Override
    public GroupInfo readGroupMetadata(String groupName) throws PersistenceException {
        Path file = infoFile(groupName);
        synchronized (lockFor(file)) {
            if (!Files.exists(file)) {
                return null;
            }
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                GroupInfo info = gson.fromJson(reader, GroupInfo.class);
                if (info == null) {
                    throw new CorruptedLogException("Empty group info file " + file, null);
                }
                return info;
            } catch (JsonParseException e) {
                throw new CorruptedLogException("Unable to decode " + file, e);
            } catch (IOException e) {
                throw new PersistenceException("Unable to read " + file, e);
            }
        }
    }

    /*
     * --- file layout ---
     */

    Path logFile(ConversationKey key) {
        if (key.isGroup()) {
            return groupsDir.resolve(key.name() + GROUP_LOG_SUFFIX);
        }
        return logDir.resolve(key.name() + PAIR_SEPARATOR + key.peer() + CONVERSATION_SUFFIX);
    }

    Path infoFile(String groupName) {
        return groupsDir.resolve(groupName + GROUP_INFO_SUFFIX);
    }

    private Object lockFor(Path file) {
        return fileLocks.computeIfAbsent(file.toAbsolutePath().normalize(), f -> new Object());
    }

    /**
     * Reads the array of entries held in the supplied file.  An absent file is an empty conversation.  The caller
     * must hold the file's lock.
     */
    private List<ChatEntry> readEntries(Path file) throws PersistenceException {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<ChatEntry> entries = gson.fromJson(reader, ENTRY_LIST_TYPE);
            if (entries == null) {
                // an empty file is not a valid JSON array either
                throw new CorruptedLogException("Empty conversation log " + file, null);
            }
            return new ArrayList<>(entries);
        } catch (JsonParseException e) {
            throw new CorruptedLogException("Unable to decode " + file, e);
        } catch (IOException e) {
            throw new PersistenceException("Unable to read " + file, e);
        }
    }

    /**
     * Writes content to a temporary sibling of target and moves it over target.  The caller must hold the file's
     * lock.
     */
    private void writeAtomically(Path target, String content) throws PersistenceException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Unable to write " + target, e);
        }
    }

    private static List<String> listFileNames(Path dir, String suffix) throws PersistenceException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(suffix))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PersistenceException("Unable to list " + dir, e);
        }
    }

    /**
     * Writes MessageType as its lower case value ("direct", "group"), which is what the chat viewer expects.
     */
    private static class MessageTypeAdapter extends TypeAdapter<MessageType> {
        @Override
        public void write(JsonWriter out, MessageType value) throws IOException {
            if (value == null) {
                out.nullValue();
            } else {
                out.value(value.getValue());
            }
        }

        @Override
        public MessageType read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            String value = in.nextString();
            MessageType type = MessageType.of(value);
            if (type == null) {
                throw new JsonParseException("Unknown message type: " + value);
            }
            return type;
        }
    }
}
