package org.anarplex.lib.chat.env;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory PersistenceService that keeps every conversation and group info record in maps.
 */
public class MockPersistenceService implements PersistenceService {

    private final Map<ConversationKey, List<ChatEntry>> conversations = new ConcurrentHashMap<>();
    private final Map<String, GroupInfo> groupInfos = new ConcurrentHashMap<>();
    private volatile boolean failWrites = false;

    @Override
    public void init() {
        // No initialization needed for in-memory implementation
    }

    @Override
    public void close() {
        conversations.clear();
        groupInfos.clear();
    }

    /**
     * Makes every later write fail, as a full disk would.
     */
    public void setFailWrites(boolean failWrites) {
        this.failWrites = failWrites;
    }

    @Override
    public void append(ConversationKey key, ChatEntry entry) throws PersistenceException {
        if (failWrites) {
            throw new PersistenceException("No space left on device");
        }
        conversations.computeIfAbsent(key, k -> new ArrayList<>());
        synchronized (conversations.get(key)) {
            conversations.get(key).add(entry);
        }
    }

    @Override
    public List<ChatEntry> readConversation(ConversationKey key) {
        List<ChatEntry> entries = conversations.get(key);
        if (entries == null) {
            return new ArrayList<>();
        }
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    @Override
    public List<ConversationKey> listConversations() {
        return new ArrayList<>(conversations.keySet());
    }

    @Override
    public void writeGroupMetadata(GroupInfo groupInfo) throws PersistenceException {
        if (failWrites) {
            throw new PersistenceException("No space left on device");
        }
        groupInfos.put(groupInfo.groupName(), groupInfo);
    }

    @Override
    public void deleteGroupMetadata(String groupName) {
        groupInfos.remove(groupName);
    }

    @Override
    public GroupInfo readGroupMetadata(String groupName) {
        return groupInfos.get(groupName);
    }

    public int totalEntries() {
        return conversations.values().stream().mapToInt(List::size).sum();
    }
}
