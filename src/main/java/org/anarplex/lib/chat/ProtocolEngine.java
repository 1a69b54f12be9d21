package org.anarplex.lib.chat;

import org.anarplex.lib.chat.env.NetworkUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.net.SocketException;

/**
 * This class runs the chat protocol for a single client connection: the login handshake, the request loop and the
 * teardown.  It is designed to be used by one thread per connection; the registries and router it is given are the
 * shared, thread-safe parts.
 * <pre>
 *   CONNECTING -> AWAITING_NAME -> ACTIVE -> CLOSED
 *                      |                       ^
 *                      +-- name taken/invalid -+
 * </pre>
 */
public class ProtocolEngine {

    private static final Logger logger = LoggerFactory.getLogger(ProtocolEngine.class);

    public enum State {
        CONNECTING,
        AWAITING_NAME,
        ACTIVE,
        CLOSED
    }

    private final SessionRegistry sessionRegistry;
    private final MessageRouter messageRouter;
    private final CommandDispatcher dispatcher;
    private final NetworkUtilities.ProtocolStreams protocolStreams;

    private volatile State state = State.CONNECTING;

    /**
     * Creates a new engine for use by a single chat client.  The engine must not be shared between connections.
     */
    public ProtocolEngine(SessionRegistry sessionRegistry, MessageRouter messageRouter, CommandDispatcher dispatcher,
                          NetworkUtilities.ProtocolStreams protocolStreams) {
        if (sessionRegistry == null || messageRouter == null || dispatcher == null || protocolStreams == null) {
            throw new NullPointerException("sessionRegistry, messageRouter, dispatcher and protocolStreams must not be null");
        }
        this.sessionRegistry = sessionRegistry;
        this.messageRouter = messageRouter;
        this.dispatcher = dispatcher;
        this.protocolStreams = protocolStreams;
    }

    public State getState() {
        return state;
    }

    /**
     * Consumes a stream of request lines from the client until it quits, disconnects or its connection fails.
     * Before returning, this method deregisters the client's session (if it logged in), announces its departure to
     * everybody else and closes the supplied protocol streams.
     * If the client ends the dialog gracefully (via /quit or by closing its end), true is returned.  If the login
     * was refused or the connection failed, false is returned.
     *
     * @return true if the dialog with the client ended without errors, false otherwise
     */
    public boolean start() {
        Session session = null;
        try {
            state = State.AWAITING_NAME;
            if (!sendLine(Protocol.USERNAME_PROMPT)) {
                return false;
            }
            String requestedName = protocolStreams.readLine(Protocol.MAX_LINE_LENGTH);
            if (requestedName == null) {
                logger.info("{} disconnected before logging in", protocolStreams.getRemoteAddress());
                return false;
            }
            Protocol.DisplayName name;
            try {
                name = new Protocol.DisplayName(requestedName.strip());
            } catch (Protocol.DisplayName.InvalidNameException e) {
                logger.warn("Refused login from {}: {}", protocolStreams.getRemoteAddress(), e.getMessage());
                sendLine(Protocol.INVALID_NAME);
                return false;
            }
            try {
                session = sessionRegistry.register(name.getValue(), protocolStreams);
            } catch (SessionRegistry.NameTakenException e) {
                logger.warn("Refused login from {}: {}", protocolStreams.getRemoteAddress(), e.getMessage());
                sendLine(Protocol.NAME_TAKEN);
                return false;
            }

            state = State.ACTIVE;
            messageRouter.announce(Protocol.joined(session.getName()), session);
            session.send(Protocol.welcome(session.getName()));

            CommandDispatcher.ClientContext clientContext = new CommandDispatcher.ClientContext(session);
            String line;
            while ((line = protocolStreams.readLine(Protocol.MAX_LINE_LENGTH)) != null) {
                logger.debug("Received request line from {}: {}", name, line);
                if (line.isBlank()) {
                    continue;
                }
                if (!dispatcher.dispatch(clientContext, line)) {
                    // the client's own connection failed while it was being answered
                    logger.info("Connection of {} failed while replying", session);
                    return false;
                }
                if (clientContext.isTerminated()) {
                    return true;
                }
            }
            // end of stream: the client closed its end
            return true;
        } catch (NetworkUtilities.LineTooLongException e) {
            logger.warn("Closing connection of {}: {}", describe(session), e.getMessage());
            sendLine(Protocol.LINE_TOO_LONG);
            return false;
        } catch (SocketException e) {
            logger.info("Connection of {} lost: {}", describe(session), e.getMessage());
            return false;
        } catch (IOException e) {
            logger.error("Error reading from client socket of {}: {}", describe(session), e.getMessage(), e);
            return false;
        } catch (RuntimeException e) {
            // an unexpected failure ends this connection only
            logger.error("Unexpected error serving {}: {}", describe(session), e.getMessage(), e);
            return false;
        } finally {
            state = State.CLOSED;
            if (session != null && sessionRegistry.deregister(session)) {
                messageRouter.announce(Protocol.left(session.getName()), session);
            }
            protocolStreams.closeConnection();
        }
    }

    /**
     * Writes one line before a session exists.
     */
    private boolean sendLine(String line) {
        PrintWriter responseStream = protocolStreams.getWriter();
        synchronized (responseStream) {
            responseStream.write(line);
            responseStream.write(Protocol.LF);
            responseStream.flush();
            return !responseStream.checkError();
        }
    }

    private String describe(Session session) {
        return (session == null) ? protocolStreams.getRemoteAddress() : session.toString();
    }
}
