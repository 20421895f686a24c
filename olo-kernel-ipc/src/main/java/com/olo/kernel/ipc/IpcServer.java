package com.olo.kernel.ipc;

import com.olo.kernel.config.IpcLimits;
import com.olo.kernel.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP front end. One task per connection, at most {@code maxConnections} at a time; a connection over the limit
 * gets a single {@code UNAVAILABLE} ERROR frame and is closed. Each REQUEST frame is answered with one frame.
 * Connections check for shutdown between frames and close after {@code readTimeoutSeconds} of silence.
 */
public final class IpcServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IpcServer.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final KernelDispatcher dispatcher;
    private final String host;
    private final int port;
    private final IpcLimits limits;
    private final FrameCodec codec;
    private final Semaphore permits;
    private final Set<Socket> connections = ConcurrentHashMap.newKeySet();

    private volatile boolean running;
    private ServerSocket serverSocket;
    private ExecutorService connectionPool;
    private Thread acceptThread;

    public IpcServer(KernelDispatcher dispatcher, String host, int port, IpcLimits limits) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.host = host;
        this.port = port;
        this.limits = limits != null ? limits : IpcLimits.DEFAULT;
        this.codec = new FrameCodec(this.limits.getMaxFrameBytes());
        this.permits = new Semaphore(this.limits.getMaxConnections());
    }

    /** Binds and starts accepting. Port 0 binds an ephemeral port; see {@link #getPort()}. */
    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(host, port));
        AtomicInteger threadIndex = new AtomicInteger();
        connectionPool = Executors.newFixedThreadPool(limits.getMaxConnections(), r -> {
            Thread t = new Thread(r, "olo-kernel-ipc-conn-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;
        acceptThread = new Thread(this::acceptLoop, "olo-kernel-ipc-accept");
        acceptThread.start();
        log.info("IPC server listening | address={}:{} maxConnections={} maxFrameBytes={} readTimeoutSeconds={}",
                host, getPort(), limits.getMaxConnections(), limits.getMaxFrameBytes(), limits.getReadTimeoutSeconds());
    }

    public int getPort() {
        ServerSocket socket = serverSocket;
        return socket != null ? socket.getLocalPort() : port;
    }

    public boolean isRunning() {
        return running;
    }

    public int activeConnections() {
        return connections.size();
    }

    private void acceptLoop() {
        while (running) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (!running || serverSocket.isClosed()) {
                    break;
                }
                log.warn("IPC accept failed | error={}", e.getMessage());
                continue;
            }
            if (!permits.tryAcquire()) {
                refuse(socket);
                continue;
            }
            connections.add(socket);
            try {
                connectionPool.execute(() -> serve(socket));
            } catch (RejectedExecutionException e) {
                release(socket);
                close(socket);
            }
        }
        log.info("IPC accept loop stopped");
    }

    private void refuse(Socket socket) {
        log.warn("IPC connection refused | peer={} maxConnections={}", socket.getRemoteSocketAddress(),
                limits.getMaxConnections());
        try (OutputStream out = socket.getOutputStream()) {
            codec.writeFrame(out, dispatcher.errorFrame("", KernelDispatcher.UNAVAILABLE,
                    "Server at max_connections (" + limits.getMaxConnections() + ")"));
        } catch (IOException e) {
            log.debug("IPC refusal not delivered | peer={} error={}", socket.getRemoteSocketAddress(), e.getMessage());
        } finally {
            close(socket);
        }
    }

    private void serve(Socket socket) {
        Object peer = socket.getRemoteSocketAddress();
        log.debug("IPC connection open | peer={} active={}", peer, connections.size());
        try {
            socket.setSoTimeout(limits.getReadTimeoutSeconds() * 1000);
            InputStream in = new BufferedInputStream(socket.getInputStream());
            OutputStream out = new BufferedOutputStream(socket.getOutputStream());
            while (running) {
                Frame frame;
                try {
                    frame = codec.readFrame(in);
                } catch (FrameException e) {
                    log.warn("IPC bad frame | peer={} error={}", peer, e.getMessage());
                    send(out, dispatcher.errorFrame("", ErrorKind.VALIDATION.getCode(), e.getMessage()));
                    break;
                }
                if (frame == null) {
                    break;
                }
                if (frame.getType() != MessageType.REQUEST) {
                    send(out, dispatcher.errorFrame("", ErrorKind.VALIDATION.getCode(),
                            "Unexpected frame type: " + frame.getType()));
                    continue;
                }
                send(out, dispatcher.dispatch(frame.getPayload()));
            }
        } catch (SocketTimeoutException e) {
            log.debug("IPC connection idle, closing | peer={}", peer);
        } catch (EOFException e) {
            log.debug("IPC connection closed mid-frame | peer={}", peer);
        } catch (SocketException e) {
            if (running) {
                log.debug("IPC connection reset | peer={} error={}", peer, e.getMessage());
            }
        } catch (IOException e) {
            log.warn("IPC connection error | peer={} error={}", peer, e.getMessage());
        } finally {
            release(socket);
            close(socket);
            log.debug("IPC connection closed | peer={}", peer);
        }
    }

    /** Writes a reply; a reply larger than the frame limit is replaced by an INTERNAL ERROR frame. */
    private void send(OutputStream out, Frame frame) throws IOException {
        if (frame.getPayload().length > codec.getMaxFrameBytes() - 1) {
            log.error("IPC reply too large | bytes={} max={}", frame.getPayload().length, codec.getMaxFrameBytes());
            frame = dispatcher.errorFrame("", ErrorKind.INTERNAL.getCode(), "Reply exceeds max frame size");
        }
        codec.writeFrame(out, frame);
    }

    private void release(Socket socket) {
        if (connections.remove(socket)) {
            permits.release();
        }
    }

    private static void close(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("IPC socket close failed | error={}", e.getMessage());
        }
    }

    /** Stops accepting, lets open connections finish their current frame, then closes what is left. */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            serverSocket.close();
        } catch (IOException e) {
            log.warn("IPC server socket close failed | error={}", e.getMessage());
        }
        connectionPool.shutdown();
        try {
            if (!connectionPool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                connections.forEach(IpcServer::close);
                connectionPool.shutdownNow();
            }
            acceptThread.join(TimeUnit.SECONDS.toMillis(SHUTDOWN_TIMEOUT_SECONDS));
        } catch (InterruptedException e) {
            connections.forEach(IpcServer::close);
            connectionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("IPC server stopped");
    }

    @Override
    public void close() {
        stop();
    }
}
