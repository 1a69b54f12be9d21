package org.anarplex.lib.chat;

import org.anarplex.lib.chat.env.MockPersistenceService;
import org.anarplex.lib.chat.env.MockProtocolStreams;
import org.anarplex.lib.chat.env.PersistenceService.GroupInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class GroupRegistryTest {

    private SessionRegistry sessionRegistry;
    private MockPersistenceService persistenceService;
    private GroupRegistry groupRegistry;
    private MockProtocolStreams aliceStreams;
    private MockProtocolStreams bobStreams;
    private MockProtocolStreams carolStreams;

    @BeforeEach
    void setUp() throws SessionRegistry.NameTakenException {
        sessionRegistry = new SessionRegistry();
        persistenceService = new MockPersistenceService();
        groupRegistry = new GroupRegistry(sessionRegistry, persistenceService);

        aliceStreams = new MockProtocolStreams("");
        bobStreams = new MockProtocolStreams("");
        carolStreams = new MockProtocolStreams("");
        sessionRegistry.register("alice", aliceStreams);
        sessionRegistry.register("bob", bobStreams);
        sessionRegistry.register("carol", carolStreams);
    }

    @Test
    @DisplayName("Create, add, admin hand-over and deletion of a group")
    void groupLifecycle() throws GroupRegistry.GroupException {
        GroupInfo created = groupRegistry.create("alice", "g1");
        assertEquals("alice", created.admin());
        assertEquals(List.of("alice"), created.members());
        assertNotNull(persistenceService.readGroupMetadata("g1"));

        GroupInfo afterAdd = groupRegistry.addMember("alice", "g1", "bob");
        assertEquals(List.of("alice", "bob"), afterAdd.members());
        assertTrue(bobStreams.getLines().contains("You have been added to group 'g1' by alice"));
        assertEquals(List.of("alice", "bob"), persistenceService.readGroupMetadata("g1").members());
        assertEquals(List.of("g1"), groupRegistry.listForUser("alice").stream().map(GroupInfo::groupName).toList());
        assertEquals(List.of("g1"), groupRegistry.listForUser("bob").stream().map(GroupInfo::groupName).toList());

        GroupInfo afterAdminLeft = groupRegistry.leave("alice", "g1");
        assertNotNull(afterAdminLeft);
        assertEquals("bob", afterAdminLeft.admin());
        assertEquals(List.of("bob"), afterAdminLeft.members());
        assertTrue(bobStreams.getLines().contains("You are now the admin of group 'g1'"));
        assertEquals(1, groupRegistry.listForUser("bob").size());
        assertEquals("bob", persistenceService.readGroupMetadata("g1").admin());

        assertNull(groupRegistry.leave("bob", "g1"));
        assertThrows(GroupRegistry.NoSuchGroupException.class, () -> groupRegistry.listMembers("bob", "g1"));
        assertNull(persistenceService.readGroupMetadata("g1"));
        assertTrue(groupRegistry.listForUser("bob").isEmpty());
    }

    @Test
    void groupNoticesReachEveryOnlineMember() throws GroupRegistry.GroupException {
        groupRegistry.create("alice", "g1");
        groupRegistry.addMember("alice", "g1", "bob");
        groupRegistry.addMember("alice", "g1", "carol");

        assertTrue(aliceStreams.getLines().contains("[g1] carol has been added to the group by alice"));
        assertTrue(bobStreams.getLines().contains("[g1] carol has been added to the group by alice"));
        assertTrue(carolStreams.getLines().contains("[g1] carol has been added to the group by alice"));

        groupRegistry.leave("carol", "g1");
        assertTrue(aliceStreams.getLines().contains("[g1] carol has left the group"));
        assertTrue(bobStreams.getLines().contains("[g1] carol has left the group"));
        assertFalse(carolStreams.getLines().contains("[g1] carol has left the group"));
    }

    @Test
    @DisplayName("The earliest joined remaining member inherits the admin role")
    void adminHandOverIsDeterministic() throws GroupRegistry.GroupException {
        groupRegistry.create("alice", "g1");
        groupRegistry.addMember("alice", "g1", "carol");
        groupRegistry.addMember("alice", "g1", "bob");

        GroupInfo info = groupRegistry.leave("alice", "g1");
        assertEquals("carol", info.admin());
        assertEquals(List.of("carol", "bob"), info.members());
    }

    @Test
    void creatingExistingGroupFails() throws GroupRegistry.GroupException {
        groupRegistry.create("alice", "g1");
        GroupRegistry.GroupException e = assertThrows(GroupRegistry.ExistingGroupException.class,
                () -> groupRegistry.create("bob", "g1"));
        assertEquals("Group 'g1' already exists", e.getMessage());
        assertEquals("alice", groupRegistry.listMembers("alice", "g1").admin());
    }

    @Test
    void addMemberValidation() throws GroupRegistry.GroupException {
        assertThrows(GroupRegistry.NoSuchGroupException.class, () -> groupRegistry.addMember("alice", "nope", "bob"));

        groupRegistry.create("alice", "g1");
        GroupRegistry.GroupException notAdmin = assertThrows(GroupRegistry.NotAdminException.class,
                () -> groupRegistry.addMember("bob", "g1", "carol"));
        assertEquals("Only the admin can add members to 'g1'", notAdmin.getMessage());

        GroupRegistry.GroupException offline = assertThrows(GroupRegistry.UserOfflineException.class,
                () -> groupRegistry.addMember("alice", "g1", "dave"));
        assertEquals("User 'dave' is not online", offline.getMessage());

        groupRegistry.addMember("alice", "g1", "bob");
        assertThrows(GroupRegistry.AlreadyMemberException.class, () -> groupRegistry.addMember("alice", "g1", "bob"));
        assertThrows(GroupRegistry.AlreadyMemberException.class, () -> groupRegistry.addMember("alice", "g1", "alice"));

        assertEquals(List.of("alice", "bob"), groupRegistry.listMembers("alice", "g1").members());
    }

    @Test
    void leaveValidation() throws GroupRegistry.GroupException {
        assertThrows(GroupRegistry.NoSuchGroupException.class, () -> groupRegistry.leave("alice", "nope"));

        groupRegistry.create("alice", "g1");
        GroupRegistry.GroupException e = assertThrows(GroupRegistry.NotMemberException.class,
                () -> groupRegistry.leave("bob", "g1"));
        assertEquals("You are not a member of group 'g1'", e.getMessage());
    }

    @Test
    void listMembersRequiresMembership() throws GroupRegistry.GroupException {
        groupRegistry.create("alice", "g1");
        assertThrows(GroupRegistry.NotMemberException.class, () -> groupRegistry.listMembers("bob", "g1"));
        assertThrows(GroupRegistry.NoSuchGroupException.class, () -> groupRegistry.listMembers("alice", "g2"));
        assertEquals(List.of("alice"), groupRegistry.listMembers("alice", "g1").members());
    }

    @Test
    void listForUserKeepsCreationOrder() throws GroupRegistry.GroupException {
        groupRegistry.create("alice", "zeta");
        groupRegistry.create("bob", "alpha");
        groupRegistry.addMember("bob", "alpha", "alice");

        List<GroupInfo> groups = groupRegistry.listForUser("alice");
        assertEquals(List.of("zeta", "alpha"), groups.stream().map(GroupInfo::groupName).toList());
        assertEquals("bob", groups.get(1).admin());
        assertEquals(2, groups.get(1).members().size());
    }

    @Test
    void metadataWriteFailureDoesNotUndoTheChange() throws GroupRegistry.GroupException {
        persistenceService.setFailWrites(true);
        groupRegistry.create("alice", "g1");
        assertEquals(List.of("g1"), groupRegistry.listForUser("alice").stream().map(GroupInfo::groupName).toList());
    }

    @Test
    @DisplayName("Admin is a member and no group is empty, whatever the interleaving")
    void concurrentLeavesKeepInvariants() throws Exception {
        List<String> users = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String user = "user" + i;
            sessionRegistry.register(user, new MockProtocolStreams(""));
            users.add(user);
        }
        // the last user never leaves, so the group survives and can be watched through its membership
        String survivor = users.get(users.size() - 1);
        groupRegistry.create(users.get(0), "busy");
        for (String user : users.subList(1, users.size())) {
            groupRegistry.addMember(users.get(0), "busy", user);
        }

        ExecutorService executor = Executors.newFixedThreadPool(users.size());
        CountDownLatch startSignal = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (String user : users.subList(0, users.size() - 1)) {
                futures.add(executor.submit(() -> {
                    startSignal.await();
                    groupRegistry.leave(user, "busy");
                    GroupInfo info = groupRegistry.listForUser(survivor).get(0);
                    assertFalse(info.members().contains(user));
                    assertTrue(info.members().contains(info.admin()));
                    return null;
                }));
            }
            startSignal.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            executor.shutdownNow();
        }

        GroupInfo last = groupRegistry.listForUser(survivor).get(0);
        assertEquals(List.of(survivor), last.members());
        assertEquals(survivor, last.admin());
        assertEquals(survivor, persistenceService.readGroupMetadata("busy").admin());
    }
}
