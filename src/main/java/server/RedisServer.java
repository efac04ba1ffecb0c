package server;

import command.CommandHandler;
import config.ConnectionMode;
import config.ServerConfig;
import lombok.extern.slf4j.Slf4j;
import service.ExpirySweeper;
import service.StorageService;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 서버의 메인 클래스
 * 소켓 바인딩, 클라이언트 연결 수락, 연결 처리 방식에 따른 핸들러 배정을 담당합니다.
 */
@Slf4j
public class RedisServer implements AutoCloseable {

    private static final int BACKLOG = 50;

    private final ServerConfig config;
    private final StorageService storageService;
    private final CommandHandler commandHandler;
    private final Set<Socket> clientSockets = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private ExecutorService workerPool;
    private ExpirySweeper expirySweeper;
    private volatile boolean closed = false;

    public RedisServer(ServerConfig config) {
        this(config, new StorageService());
    }

    public RedisServer(ServerConfig config, StorageService storageService) {
        this.config = config;
        this.storageService = storageService;
        this.commandHandler = new CommandHandler(storageService);
    }

    /**
     * 서버를 바인딩하고 연결 수락 루프를 실행합니다. close()가 호출될 때까지 반환하지 않습니다.
     */
    public void start() throws IOException {
        bind();
        serve();
    }

    /**
     * 서버 소켓을 생성하고 설정된 주소에 바인딩합니다.
     */
    public synchronized void bind() throws IOException {
        if (serverSocket != null) {
            throw new IllegalStateException("Server is already bound to port " + serverSocket.getLocalPort());
        }
        ServerSocket socket = new ServerSocket();
        // 서버 재시작 시 'Address already in use' 에러 방지
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(InetAddress.getByName(config.getHost()), config.getPort()), BACKLOG);
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        serverSocket = socket;

        if (config.getConnectionMode() == ConnectionMode.CONCURRENT) {
            workerPool = Executors.newCachedThreadPool(new ClientThreadFactory());
        }
        if (config.isSweepEnabled()) {
            expirySweeper = new ExpirySweeper(storageService, config.getSweepIntervalMillis());
            expirySweeper.start();
        }
        log.info("Server listening on {} ({} mode)", serverSocket.getLocalSocketAddress(), config.getConnectionMode());
    }

    /**
     * 연결 수락 루프. 개별 연결의 실패는 다른 연결이나 루프에 영향을 주지 않습니다.
     */
    public void serve() {
        ServerSocket listener;
        synchronized (this) {
            if (serverSocket == null) {
                throw new IllegalStateException("Server is not bound");
            }
            listener = serverSocket;
        }
        log.info("Waiting for connections...");

        while (!closed) {
            Socket clientSocket;
            try {
                clientSocket = listener.accept();
            } catch (IOException e) {
                if (closed || listener.isClosed()) {
                    break;
                }
                log.warn("Error accepting client connection: {}", e.getMessage());
                continue;
            }
            log.info("Client connected: {}", clientSocket.getRemoteSocketAddress());
            dispatch(clientSocket);
        }
        log.info("Accept loop stopped");
    }

    private void dispatch(Socket clientSocket) {
        try {
            clientSocket.setTcpNoDelay(true);
        } catch (IOException e) {
            log.debug("Could not set TCP_NODELAY for {}: {}", clientSocket.getRemoteSocketAddress(), e.getMessage());
        }
        clientSockets.add(clientSocket);
        if (closed) {
            clientSockets.remove(clientSocket);
            closeQuietly(clientSocket);
            return;
        }
        Runnable task = () -> {
            try {
                new ClientHandler(clientSocket, commandHandler).run();
            } finally {
                clientSockets.remove(clientSocket);
            }
        };

        if (workerPool == null) {
            // 순차 처리: 현재 연결이 끝나야 다음 accept로 넘어갑니다
            task.run();
            return;
        }
        try {
            workerPool.execute(task);
        } catch (RejectedExecutionException e) {
            log.warn("Server is shutting down, dropping connection {}", clientSocket.getRemoteSocketAddress());
            clientSockets.remove(clientSocket);
            closeQuietly(clientSocket);
        }
    }

    /**
     * 실제로 바인딩된 포트 (포트 0으로 바인딩한 경우 OS가 고른 포트)
     */
    public synchronized int getLocalPort() {
        if (serverSocket == null) {
            throw new IllegalStateException("Server is not bound");
        }
        return serverSocket.getLocalPort();
    }

    public StorageService getStorageService() {
        return storageService;
    }

    /**
     * 연결 수락을 중단하고 열린 연결과 작업 스레드, 백그라운드 정리를 모두 종료합니다.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (serverSocket != null) {
            closeQuietly(serverSocket);
        }
        for (Socket clientSocket : clientSockets) {
            closeQuietly(clientSocket);
        }
        if (workerPool != null) {
            workerPool.shutdownNow();
        }
        if (expirySweeper != null) {
            expirySweeper.close();
        }
        log.info("Server stopped");
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Error while closing {}: {}", closeable, e.getMessage());
        }
    }

    private static final class ClientThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "client-handler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
