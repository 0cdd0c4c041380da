package org.dgov.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Point-to-point transport over TCP.
 * <p>
 * Each payload travels on its own connection as a single Base64 line. The
 * receiving side hands every line it reads to all registered handlers;
 * silent connections time out and overlong lines are dropped. There
 * is no acknowledgement beyond the connection being accepted, so the sender
 * may redeliver and receivers must tolerate duplicates.
 */
public class TcpMessageTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(TcpMessageTransport.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 5000;
    public static final int READ_TIMEOUT_MILLIS = 30_000;
    public static final int MAX_LINE_CHARS = 1 << 20; // Base64 of a 768 KiB payload

    private final int listenPort;
    private final int readTimeoutMillis;
    private final int maxLineChars;
    private final Map<String, InetSocketAddress> routes = new ConcurrentHashMap<>();
    private final List<MessageHandler> handlers = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final CountDownLatch bound = new CountDownLatch(1);

    private volatile boolean running = false;
    private volatile ServerSocket serverSocket;

    /**
     * @param listenPort port for inbound messages, 0 picks a free one
     */
    public TcpMessageTransport(int listenPort) {
        this(listenPort, READ_TIMEOUT_MILLIS, MAX_LINE_CHARS);
    }

    /**
     * @param readTimeoutMillis how long an inbound connection may stay silent
     * @param maxLineChars      longest inbound line accepted; longer ones are dropped
     */
    public TcpMessageTransport(int listenPort, int readTimeoutMillis, int maxLineChars) {
        if (listenPort < 0 || listenPort > 65535) {
            throw new IllegalArgumentException("Invalid port: " + listenPort);
        }
        if (readTimeoutMillis <= 0 || maxLineChars <= 0) {
            throw new IllegalArgumentException("Read timeout and line limit must be positive");
        }
        this.listenPort = listenPort;
        this.readTimeoutMillis = readTimeoutMillis;
        this.maxLineChars = maxLineChars;
    }

    // ---------------------------------------------------------------------
    //                         ROUTING
    // ---------------------------------------------------------------------

    public void addRoute(String chainId, String host, int port) {
        routes.put(chainId, new InetSocketAddress(host, port));
        log.info("[TcpMessageTransport] Route " + chainId + " -> " + host + ":" + port);
    }

    @Override
    public void registerHandler(MessageHandler handler) {
        handlers.add(handler);
        log.info("[TcpMessageTransport] Registered handler: " + handler.getClass().getSimpleName());
    }

    // ---------------------------------------------------------------------
    //                         SENDING
    // ---------------------------------------------------------------------

    @Override
    public TransportReceipt send(String destinationChain, String receiverAddress, byte[] payload) throws TransportException {
        InetSocketAddress target = routes.get(destinationChain);
        if (target == null) {
            throw new TransportException("No route to chain " + destinationChain);
        }
        try (Socket socket = new Socket()) {
            socket.connect(target, CONNECT_TIMEOUT_MILLIS);
            PrintWriter out = new PrintWriter(socket.getOutputStream(), false, StandardCharsets.UTF_8);
            out.print(Base64.getEncoder().encodeToString(payload));
            out.print('\n');
            out.flush();
            if (out.checkError()) {
                throw new TransportException("Write to " + target + " failed");
            }
            log.debug("[TcpMessageTransport] Sent " + payload.length + " bytes to " + destinationChain + " at " + target);
            return new TransportReceipt(destinationChain, receiverAddress, payload.length, System.currentTimeMillis());
        } catch (IOException e) {
            throw new TransportException("Failed to reach chain " + destinationChain + " at " + target + ": " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------------
    //                         LISTENING
    // ---------------------------------------------------------------------

    /**
     * Starts the accept loop in the background and waits until the port is bound.
     */
    public void start() {
        if (running) {
            return;
        }
        running = true;
        executor.submit(this::listen);
        try {
            if (!bound.await(CONNECT_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                log.warn("[TcpMessageTransport] Listener did not bind within " + CONNECT_TIMEOUT_MILLIS + " ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void stop() {
        running = false;
        ServerSocket socket = serverSocket;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                log.warn("[TcpMessageTransport] Error closing listener: " + e.getMessage());
            }
        }
        executor.shutdownNow();
        log.info("[TcpMessageTransport] Listener stopped.");
    }

    /**
     * Port actually bound, or -1 before {@link #start()}.
     */
    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    private void listen() {
        try (ServerSocket server = new ServerSocket(listenPort)) {
            serverSocket = server;
            bound.countDown();
            log.info("[TcpMessageTransport] Listening for cross-chain messages on port " + server.getLocalPort());
            while (running) {
                Socket clientSocket = server.accept();
                executor.submit(() -> read(clientSocket));
            }
        } catch (IOException e) {
            if (running) {
                log.error("[TcpMessageTransport] Listener error: " + e.getMessage(), e);
            }
        } finally {
            bound.countDown();
        }
    }

    private void read(Socket clientSocket) {
        try (Socket socket = clientSocket;
             BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8))) {
            socket.setSoTimeout(readTimeoutMillis);
            String line = readLine(in);
            if (line.isBlank()) {
                return;
            }
            byte[] payload;
            try {
                payload = Base64.getDecoder().decode(line.trim());
            } catch (IllegalArgumentException e) {
                log.warn("[TcpMessageTransport] Dropped non-Base64 line from " + socket.getRemoteSocketAddress());
                return;
            }
            for (MessageHandler handler : handlers) {
                handler.onMessage(payload);
            }
        } catch (IOException e) {
            log.warn("[TcpMessageTransport] Dropped connection from " + clientSocket.getRemoteSocketAddress()
                    + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("[TcpMessageTransport] Handler failed: " + e.getMessage(), e);
        }
    }

    /**
     * Reads up to the first newline or end of stream.
     *
     * @throws IOException if the line exceeds {@code maxLineChars} or the peer stays silent too long
     */
    private String readLine(Reader in) throws IOException {
        StringBuilder line = new StringBuilder();
        int c;
        while ((c = in.read()) != -1 && c != '\n') {
            if (line.length() >= maxLineChars) {
                throw new IOException("line exceeds " + maxLineChars + " characters");
            }
            line.append((char) c);
        }
        return line.toString();
    }
}
