package org.anarplex.lib.chat;

import org.anarplex.lib.chat.env.NetworkUtilities;

import java.io.PrintWriter;
import java.util.List;

/**
 * The live binding between one client connection and the display name it logged in with.  Sessions are created and
 * destroyed by the SessionRegistry only.
 * Any thread may send to a Session; lines from different senders are never interleaved.
 */
public class Session {

    private final String name;
    private final NetworkUtilities.ProtocolStreams connection;

    Session(String name, NetworkUtilities.ProtocolStreams connection) {
        this.name = name;
        this.connection = connection;
    }

    public String getName() {
        return name;
    }

    /**
     * Sends one line to the client.
     *
     * @return false if the connection is known to be broken, true otherwise
     */
    public boolean send(String line) {
        return send(List.of(line));
    }

    /**
     * Sends several lines to the client as one uninterrupted block.
     *
     * @return false if the connection is known to be broken, true otherwise
     */
    public boolean send(List<String> lines) {
        PrintWriter writer = connection.getWriter();
        synchronized (writer) {
            for (String line : lines) {
                writer.write(line);
                writer.write(Protocol.LF);
            }
            writer.flush();
            // PrintWriter never throws; once the socket fails the error flag stays set
            return !writer.checkError();
        }
    }

    @Override
    public String toString() {
        return name + "@" + connection.getRemoteAddress();
    }
}
