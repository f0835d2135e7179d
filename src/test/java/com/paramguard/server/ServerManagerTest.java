package com.paramguard.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import com.paramguard.validation.ValidationPolicy;
import com.sun.net.httpserver.HttpServer;

class ServerManagerTest {

    private final List<InetSocketAddress> requestedAddresses = new ArrayList<>();

    private static ServerConfig config(final int threads) {
        return new ServerConfig(8089, "127.0.0.1", 3, threads, ValidationPolicy.FAIL_FAST, false, null);
    }

    private ServerManager manager(final ServerConfig config, final HttpServer... servers) {
        List<HttpServer> queue = new ArrayList<>(List.of(servers));
        return new ServerManager(config, address -> {
            requestedAddresses.add(address);
            return queue.remove(0);
        });
    }

    @Test
    void testStartServer_BindsConfiguredAddress() throws IOException {
        HttpServer server = mock(HttpServer.class);
        when(server.getAddress()).thenReturn(new InetSocketAddress("127.0.0.1", 8089));
        ServerManager manager = manager(config(0), server);

        assertSame(server, manager.startServer());

        assertEquals(new InetSocketAddress("127.0.0.1", 8089), requestedAddresses.get(0));
        verify(server).setExecutor(isNull());
        verify(server).start();
        assertTrue(manager.isServerRunning());
        assertEquals(8089, manager.boundPort());
    }

    @Test
    void testStartServer_UsesThreadPoolWhenConfigured() throws IOException {
        HttpServer server = mock(HttpServer.class);
        ServerManager manager = manager(config(2), server);

        manager.startServer();

        verify(server).setExecutor(any(Executor.class));
        manager.stopServer();
    }

    @Test
    void testStartServer_RestartStopsPreviousServer() throws IOException {
        HttpServer first = mock(HttpServer.class);
        HttpServer second = mock(HttpServer.class);
        ServerManager manager = manager(config(0), first, second);

        manager.startServer();
        manager.startServer();

        InOrder order = inOrder(first, second);
        order.verify(first).start();
        order.verify(first).stop(3);
        order.verify(second).start();
        assertSame(second, manager.getServer());
    }

    @Test
    void testStopServer_UsesConfiguredDelay() throws IOException {
        HttpServer server = mock(HttpServer.class);
        ServerManager manager = manager(config(0), server);
        manager.startServer();

        manager.stopServer();
        manager.stopServer();

        verify(server).stop(3);
        assertFalse(manager.isServerRunning());
        assertNull(manager.getServer());
        assertEquals(8089, manager.boundPort());
    }

    @Test
    void testStartServer_BindFailurePropagates() {
        ServerManager manager = new ServerManager(config(0), address -> {
            throw new BindException("Address already in use");
        });

        assertThrows(BindException.class, manager::startServer);
        assertFalse(manager.isServerRunning());
    }

    @Test
    void testStopServer_WhenNotRunning() {
        HttpServer server = mock(HttpServer.class);
        ServerManager manager = manager(config(0), server);
        manager.stopServer();
        verify(server, never()).stop(3);
    }
}
