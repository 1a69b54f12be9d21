package org.anarplex.lib.chat.env;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SocketNetworkUtilitiesTest {

    @Test
    @DisplayName("A lasting accept failure is retried at a slow pace")
    void failingAcceptIsRetriedWithDelay() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        ServerSocket exhausted = new ServerSocket() {
            @Override
            public Socket accept() throws IOException {
                attempts.incrementAndGet();
                throw new IOException("Too many open files");
            }
        };
        SocketNetworkUtilities.ServiceManager serviceManager =
                new SocketNetworkUtilities.ServiceManager(exhausted, connection -> fail("no connection was accepted"));

        serviceManager.start();
        Thread.sleep(SocketNetworkUtilities.ACCEPT_RETRY_DELAY_MILLIS * 5);
        serviceManager.terminate();

        int seen = attempts.get();
        assertTrue(seen >= 1, "accept was attempted");
        assertTrue(seen <= 10, "accept was retried " + seen + " times");
    }
}
