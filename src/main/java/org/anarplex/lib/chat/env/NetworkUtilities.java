package org.anarplex.lib.chat.env;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;

public interface NetworkUtilities {

    /**
     * The communication pathway between one chat client and its Protocol Engine.
     */
    interface ProtocolStreams {
        BufferedReader getReader();
        PrintWriter getWriter();

        /**
         * A printable description of the remote end, for logging.
         */
        String getRemoteAddress();
        void closeConnection();

        /**
         * Reads one LF terminated line (a CR before the LF is dropped) of at most maxLength characters.  Reading stops
         * as soon as the limit is exceeded, so a client that never sends LF cannot make the line grow without bound.
         *
         * @return the line without its terminator, or null at end of stream
         * @throws LineTooLongException if the line exceeds maxLength characters.  The rest of it is left unread
         */
        default String readLine(int maxLength) throws IOException {
            BufferedReader reader = getReader();
            StringBuilder line = new StringBuilder();
            int c;
            while ((c = reader.read()) != -1) {
                if (c == '\n') {
                    int last = line.length() - 1;
                    if (last >= 0 && line.charAt(last) == '\r') {
                        line.setLength(last);
                    }
                    return line.toString();
                }
                line.append((char) c);
                // one extra character is allowed for the CR of a CRLF
                if (line.length() > maxLength && !(line.length() == maxLength + 1 && c == '\r')) {
                    throw new LineTooLongException(maxLength);
                }
            }
            return line.length() == 0 ? null : line.toString();
        }
    }

    class LineTooLongException extends IOException {
        public LineTooLongException(int maxLength) {
            super("Line exceeds " + maxLength + " characters");
        }
    }

    /**
     * Opens a port (specified by supplied properties) to listen for incoming connections and dispatches such
     * new connections to the supplied ConnectionListener.  Returns a ServiceManager that can be used to start and
     * terminate the Service.  A failure to bind the port is reported here, before anything is started.
     */
    ServiceManager registerService(ConnectionListener cl) throws IOException;

    interface ConnectionListener {
        /**
         * Invoked when a new connection is established with a client.  The supplied ProtocolStreams is ready for
         * communication.  Each invocation runs on its own thread and may block for the lifetime of the connection.
         * Will not be invoked until start() is called on the ServiceManager.
         */
        void onConnection(ProtocolStreams newConnection);
    }

    interface ServiceManager {
        void start();
        void terminate();

        /**
         * The port actually listened on, which differs from the configured one when that was 0.
         */
        int getLocalPort();
    }
}
