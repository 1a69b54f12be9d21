package org.anarplex.lib.chat;

import org.anarplex.lib.chat.env.NetworkUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the display name of every logged-in user to its Session.  Display names are unique among the registered
 * sessions.
 * All access is serialised on the registry; the lists returned are snapshots that may be iterated (and sent to)
 * without holding any lock.
 */
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    // insertion ordered, so user lists come out in login order
    private final Map<String, Session> byName = new LinkedHashMap<>();

    public static class NameTakenException extends Exception {
        public NameTakenException(String message) {
            super(message);
        }
    }

    /**
     * Creates and registers a Session binding the supplied name to the supplied connection.  Checking for an
     * existing holder of the name and claiming it happen atomically.
     *
     * @throws NameTakenException if a live session already uses the name
     */
    public synchronized Session register(String name, NetworkUtilities.ProtocolStreams connection) throws NameTakenException {
        if (byName.containsKey(name)) {
            throw new NameTakenException("Username already taken: " + name);
        }
        Session session = new Session(name, connection);
        byName.put(name, session);
        logger.info("Registered {} ({} online)", session, byName.size());
        return session;
    }

    /**
     * Removes the supplied Session.  Does nothing if it is not (or no longer) registered.
     *
     * @return true if the session was registered
     */
    public synchronized boolean deregister(Session session) {
        if (byName.get(session.getName()) != session) {
            return false;
        }
        byName.remove(session.getName());
        logger.info("Deregistered {} ({} online)", session, byName.size());
        return true;
    }

    /**
     * Returns the Session of the named user or null if the user is not online.
     */
    public synchronized Session lookup(String name) {
        return byName.get(name);
    }

    public synchronized boolean isActive(String name) {
        return byName.containsKey(name);
    }

    /**
     * Names of all online users in login order.
     */
    public synchronized List<String> names() {
        return new ArrayList<>(byName.keySet());
    }

    /**
     * All live sessions in login order.
     */
    public synchronized List<Session> sessions() {
        return new ArrayList<>(byName.values());
    }

    public synchronized int size() {
        return byName.size();
    }
}
