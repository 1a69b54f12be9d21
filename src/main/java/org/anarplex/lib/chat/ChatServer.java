package org.anarplex.lib.chat;

import org.anarplex.lib.chat.env.JsonFilePersistenceService;
import org.anarplex.lib.chat.env.NetworkUtilities;
import org.anarplex.lib.chat.env.PersistenceService;
import org.anarplex.lib.chat.env.SocketNetworkUtilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Wires the shared registries, the router and the persistence service together and runs a Protocol Engine for every
 * connection accepted by the network service.
 */
public class ChatServer {

    private static final Logger logger = LoggerFactory.getLogger(ChatServer.class);

    public static final String CONFIG_RESOURCE = "chat.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "chat.";
    public static final String DEFAULT_LOG_DIR = "server_logs";

    private final PersistenceService persistenceService;
    private final NetworkUtilities networkUtilities;
    private final SessionRegistry sessionRegistry;
    private final GroupRegistry groupRegistry;
    private final MessageRouter messageRouter;
    private final CommandDispatcher dispatcher;

    private NetworkUtilities.ServiceManager serviceManager;

    public ChatServer(PersistenceService persistenceService, NetworkUtilities networkUtilities) {
        this.persistenceService = persistenceService;
        this.networkUtilities = networkUtilities;
        this.sessionRegistry = new SessionRegistry();
        this.groupRegistry = new GroupRegistry(sessionRegistry, persistenceService);
        this.messageRouter = new MessageRouter(sessionRegistry, groupRegistry, persistenceService);
        this.dispatcher = new CommandDispatcher(sessionRegistry, groupRegistry, messageRouter);
    }

    /**
     * Readies the persistence service, binds the listening port and starts accepting connections.
     *
     * @throws IOException if the port cannot be bound
     * @throws PersistenceService.PersistenceException if the log directory cannot be prepared
     */
    public synchronized void start() throws IOException, PersistenceService.PersistenceException {
        if (serviceManager != null) {
            throw new IllegalStateException("Server already started");
        }
        persistenceService.init();
        serviceManager = networkUtilities.registerService(this::onConnection);
        serviceManager.start();
    }

    /**
     * Stops accepting connections and closes the open ones.
     */
    public synchronized void stop() {
        if (serviceManager != null) {
            serviceManager.terminate();
            serviceManager = null;
            persistenceService.close();
            logger.info("Server stopped");
        }
    }

    public synchronized int getLocalPort() {
        if (serviceManager == null) {
            throw new IllegalStateException("Server not started");
        }
        return serviceManager.getLocalPort();
    }

    public SessionRegistry getSessionRegistry() {
        return sessionRegistry;
    }

    public GroupRegistry getGroupRegistry() {
        return groupRegistry;
    }

    private void onConnection(NetworkUtilities.ProtocolStreams newConnection) {
        ProtocolEngine protocolEngine = new ProtocolEngine(sessionRegistry, messageRouter, dispatcher, newConnection);
        if (!protocolEngine.start()) {
            logger.debug("Dialog with {} ended abnormally", newConnection.getRemoteAddress());
        }
    }

    /**
     * Builds the server configuration: the chat.properties resource on the classpath, then the properties file named
     * by the first argument (if any), then system properties prefixed with "chat." (e.g. -Dchat.port=4000).
     */
    public static Properties loadConfiguration(String[] args) throws IOException {
        Properties config = new Properties();
        config.setProperty("host", SocketNetworkUtilities.DEFAULT_HOST);
        config.setProperty("port", String.valueOf(SocketNetworkUtilities.DEFAULT_PORT));
        config.setProperty("logDir", DEFAULT_LOG_DIR);

        try (InputStream in = ChatServer.class.getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                config.load(in);
            }
        }
        if (args != null && args.length > 0) {
            try (Reader reader = Files.newBufferedReader(Path.of(args[0]), StandardCharsets.UTF_8)) {
                config.load(reader);
            }
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                config.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), System.getProperty(name));
            }
        }
        return config;
    }

    public static void main(String[] args) {
        try {
            Properties config = loadConfiguration(args);
            ChatServer server = new ChatServer(
                    new JsonFilePersistenceService(Path.of(config.getProperty("logDir"))),
                    new SocketNetworkUtilities(config));
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "chat-shutdown"));
        } catch (IOException | PersistenceService.PersistenceException | RuntimeException e) {
            logger.error("Unable to start the chat server: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
