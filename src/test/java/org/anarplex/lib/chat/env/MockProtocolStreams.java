package org.anarplex.lib.chat.env;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * In-memory ProtocolStreams: the client's requests come from a fixed string and everything the server writes is
 * kept for inspection.
 */
public class MockProtocolStreams implements NetworkUtilities.ProtocolStreams {
    private final BufferedReader reader;
    private final PrintWriter writer;
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final String address;
    private volatile boolean closed = false;

    public MockProtocolStreams(String clientInput) {
        this(clientInput, "mock");
    }

    public MockProtocolStreams(String clientInput, String address) {
        this(new ByteArrayInputStream(clientInput.getBytes(StandardCharsets.UTF_8)), address);
    }

    /**
     * Streams whose client input comes from the supplied stream, which may be endless.
     */
    public MockProtocolStreams(InputStream clientInput, String address) {
        this.reader = new BufferedReader(new InputStreamReader(clientInput, StandardCharsets.UTF_8));
        this.writer = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        this.address = address;
    }

    private MockProtocolStreams(OutputStream failing) {
        this.reader = new BufferedReader(new InputStreamReader(new ByteArrayInputStream(new byte[0]), StandardCharsets.UTF_8));
        this.writer = new PrintWriter(new OutputStreamWriter(failing, StandardCharsets.UTF_8));
        this.address = "broken";
    }

    /**
     * Streams whose every write fails, like a socket the peer has reset.
     */
    public static MockProtocolStreams broken() {
        return new MockProtocolStreams(new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("Connection reset");
            }
        });
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
        return address;
    }

    @Override
    public void closeConnection() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Everything written by the server so far.
     */
    public String getOutput() {
        synchronized (writer) {
            writer.flush();
            return output.toString(StandardCharsets.UTF_8);
        }
    }

    public List<String> getLines() {
        return getOutput().lines().toList();
    }

    public void clearOutput() {
        synchronized (writer) {
            writer.flush();
            output.reset();
        }
    }
}
