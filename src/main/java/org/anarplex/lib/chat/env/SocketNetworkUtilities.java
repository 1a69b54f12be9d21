package org.anarplex.lib.chat.env;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plain TCP implementation of NetworkUtilities.  Every accepted connection is served on a thread of its own for as
 * long as it stays open; reads are blocking and have no timeout.
 * Recognised properties: host (default localhost), port (default 12345, 0 picks a free port), backlog (default 50).
 */
public class SocketNetworkUtilities implements NetworkUtilities {
    private static final Logger logger = LoggerFactory.getLogger(SocketNetworkUtilities.class);

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 12345;
    private static final int DEFAULT_BACKLOG = 50;
    static final long ACCEPT_RETRY_DELAY_MILLIS = 200;
    private static final long TERMINATION_TIMEOUT_SECONDS = 5;

    private final Properties networkEnv;

    public SocketNetworkUtilities(Properties p) {
        this.networkEnv = new Properties();
        this.networkEnv.putAll(p);
    }

    @Override
    public NetworkUtilities.ServiceManager registerService(ConnectionListener cl) throws IOException {
        String host = networkEnv.getProperty("host", DEFAULT_HOST);
        int port = Integer.parseInt(networkEnv.getProperty("port", String.valueOf(DEFAULT_PORT)));
        int backlog = Integer.parseInt(networkEnv.getProperty("backlog", String.valueOf(DEFAULT_BACKLOG)));

        ServerSocket serverSocket = new ServerSocket();
        try {
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(host, port), backlog);
        } catch (IOException e) {
            serverSocket.close();
            throw e;
        }
        logger.info("Server is listening on {}:{}", host, serverSocket.getLocalPort());
        return new ServiceManager(serverSocket, cl);
    }


    static class ServiceManager implements NetworkUtilities.ServiceManager, Runnable {
        private final ServerSocket serverSocket;
        private final ConnectionListener listener;
        private final ExecutorService executorService = Executors.newCachedThreadPool(new ConnectionThreadFactory());
        private final Set<Socket> openConnections = ConcurrentHashMap.newKeySet();

        ServiceManager(ServerSocket serverSocket, ConnectionListener listener) {
            this.serverSocket = serverSocket;
            this.listener = listener;
        }

        @Override
        public void start() {
            Thread thread = new Thread(this, "chat-listener");
            thread.start();
        }

        @Override
        public void run() {
            while (!serverSocket.isClosed()) {
                Socket clientSocket;
                try {
                    clientSocket = serverSocket.accept();
                } catch (IOException e) {
                    if (serverSocket.isClosed()) {
                        break;      // terminate() was called
                    }
                    // e.g. out of file descriptors.  pause so a lasting failure does not spin
                    logger.error("Error accepting connection: {}", e.getMessage());
                    if (!pauseAfterFailedAccept()) {
                        break;
                    }
                    continue;
                }
                logger.info("Client connected: {}", clientSocket.getRemoteSocketAddress());
                openConnections.add(clientSocket);
                try {
                    executorService.execute(new ClientHandler(clientSocket, listener, openConnections));
                } catch (RejectedExecutionException e) {
                    logger.warn("Server is shutting down, dropping connection from {}", clientSocket.getRemoteSocketAddress());
                    openConnections.remove(clientSocket);
                    closeQuietly(clientSocket);
                }
            }
            logger.info("Server stopped listening on port {}", serverSocket.getLocalPort());
        }

        private boolean pauseAfterFailedAccept() {
            try {
                Thread.sleep(ACCEPT_RETRY_DELAY_MILLIS);
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        @Override
        public void terminate() {
            try {
                serverSocket.close();
            } catch (IOException e) {
                logger.error("Error closing server socket: {}", e.getMessage());
            }
            executorService.shutdown();
            // closing the sockets wakes up the connection threads blocked in a read
            openConnections.forEach(SocketNetworkUtilities::closeQuietly);
            try {
                if (!executorService.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    logger.warn("Connection threads still running {}s after shutdown", TERMINATION_TIMEOUT_SECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public int getLocalPort() {
            return serverSocket.getLocalPort();
        }
    }


    // Class to handle individual client connections
    private static class ClientHandler implements Runnable {
        private final Socket clientSocket;
        private final ConnectionListener listener;
        private final Set<Socket> openConnections;

        ClientHandler(Socket clientSocket, ConnectionListener listener, Set<Socket> openConnections) {
            this.clientSocket = clientSocket;
            this.listener = listener;
            this.openConnections = openConnections;
        }

        @Override
        public void run() {
            try {
                listener.onConnection(new SocketProtocolStreams(clientSocket));
            } catch (IOException e) {
                logger.error("Error creating client handler: {}", e.getMessage());
            } finally {
                openConnections.remove(clientSocket);
                closeQuietly(clientSocket);
            }
        }
    }

    public static class SocketProtocolStreams implements NetworkUtilities.ProtocolStreams {
        private final Socket connection;
        private final BufferedReader reader;
        private final PrintWriter writer;

        public SocketProtocolStreams(Socket socket) throws IOException {
            this.connection = socket;
            this.writer = new PrintWriter(
                    new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8),
                    false    // autoflush.  every send flushes explicitly
            );
            // BufferedReader collects partial reads until a whole line has arrived
            this.reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8)
            );
        }

        @Override
        public BufferedReader getReader() {
            return reader;
        }

        @Override
        public PrintWriter getWriter() {
            return writer;
        }

        @Override
        public String getRemoteAddress() {
            return String.valueOf(connection.getRemoteSocketAddress());
        }

        @Override
        public void closeConnection() {
            if (!connection.isClosed()) {
                logger.info("Client disconnected: {}", connection.getRemoteSocketAddress());
                synchronized (writer) {
                    writer.flush();
                }
                closeQuietly(connection);
            }
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("Error closing client connection: {}", e.getMessage());
        }
    }

    private static class ConnectionThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "chat-connection-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
