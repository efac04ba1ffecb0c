package server;

import client.RedisClient;
import config.ConnectionMode;
import config.ServerConfig;
import org.apache.commons.io.IOUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import protocol.Reply;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisServerTest {

    private RedisServer server;
    private Thread acceptThread;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.close();
        }
        if (acceptThread != null) {
            acceptThread.join(5000);
        }
    }

    private void startServer(ConnectionMode mode) throws IOException {
        ServerConfig config = new ServerConfig();
        config.setPort(0);
        config.setConnectionMode(mode);
        config.setSweepIntervalMillis(0);
        server = new RedisServer(config);
        server.bind();
        acceptThread = new Thread(server::serve, "test-accept-loop");
        acceptThread.start();
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", server.getLocalPort());
        socket.setSoTimeout(5000);
        return socket;
    }

    private static void send(Socket socket, String raw) throws IOException {
        OutputStream out = socket.getOutputStream();
        out.write(raw.getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    private static String receive(Socket socket, String expected) throws IOException {
        byte[] reply = IOUtils.readFully(socket.getInputStream(), expected.getBytes(StandardCharsets.UTF_8).length);
        return new String(reply, StandardCharsets.UTF_8);
    }

    @Nested
    class WireProtocol {

        @Test
        void shouldAnswerSetGetScenarioByteForByte() throws Exception {
            startServer(ConnectionMode.CONCURRENT);

            try (Socket socket = connect()) {
                send(socket, "*3\r\n$3\r\nSET\r\n$3\r\nfoo\r\n$3\r\nbar\r\n");
                assertThat(receive(socket, "+OK\r\n")).isEqualTo("+OK\r\n");

                send(socket, "*2\r\n$3\r\nGET\r\n$3\r\nfoo\r\n");
                assertThat(receive(socket, "$3\r\nbar\r\n")).isEqualTo("$3\r\nbar\r\n");

                send(socket, "*2\r\n$3\r\nGET\r\n$7\r\nnoexist\r\n");
                assertThat(receive(socket, "$-1\r\n")).isEqualTo("$-1\r\n");
            }
        }

        @Test
        void shouldReplyToPipelinedFramesInOrder() throws Exception {
            startServer(ConnectionMode.CONCURRENT);
            String expected = "+OK\r\n$1\r\n1\r\n-ERR unknown command 'FOO'\r\n$-1\r\n";

            try (Socket socket = connect()) {
                send(socket, "*3\r\n$3\r\nSET\r\n$1\r\na\r\n$1\r\n1\r\n"
                        + "*2\r\n$3\r\nGET\r\n$1\r\na\r\n"
                        + "*2\r\n$3\r\nFOO\r\n$3\r\nbar\r\n"
                        + "*2\r\n$3\r\nGET\r\n$1\r\nb\r\n");

                assertThat(receive(socket, expected)).isEqualTo(expected);
            }
        }

        @Test
        void shouldReassembleFrameSentOneByteAtATime() throws Exception {
            startServer(ConnectionMode.CONCURRENT);
            String frame = "*3\r\n$3\r\nSET\r\n$3\r\nkey\r\n$5\r\nvalue\r\n";

            try (Socket socket = connect()) {
                socket.setTcpNoDelay(true);
                for (char c : frame.toCharArray()) {
                    send(socket, String.valueOf(c));
                }

                assertThat(receive(socket, "+OK\r\n")).isEqualTo("+OK\r\n");
            }
        }

        @Test
        void shouldKeepConnectionOpenAfterCommandError() throws Exception {
            startServer(ConnectionMode.CONCURRENT);

            try (Socket socket = connect()) {
                send(socket, "*2\r\n$3\r\nFOO\r\n$3\r\nbar\r\n");
                String error = "-ERR unknown command 'FOO'\r\n";
                assertThat(receive(socket, error)).isEqualTo(error);

                send(socket, "*3\r\n$3\r\nSET\r\n$1\r\nk\r\n$1\r\nv\r\n*2\r\n$3\r\nGET\r\n$1\r\nk\r\n");
                assertThat(receive(socket, "+OK\r\n$1\r\nv\r\n")).isEqualTo("+OK\r\n$1\r\nv\r\n");
            }
        }

        @Test
        void shouldCloseOnlyOffendingConnectionOnProtocolError() throws Exception {
            startServer(ConnectionMode.CONCURRENT);

            try (Socket healthy = connect(); Socket broken = connect()) {
                // when
                send(broken, "HELLO\r\n");
                String reply = new String(IOUtils.toByteArray(broken.getInputStream()), StandardCharsets.UTF_8);

                // then
                assertThat(reply).startsWith("-ERR Protocol error:").endsWith("\r\n");
                send(healthy, "*2\r\n$3\r\nGET\r\n$1\r\nx\r\n");
                assertThat(receive(healthy, "$-1\r\n")).isEqualTo("$-1\r\n");
            }
        }
    }

    @Nested
    class ConnectionModes {

        @Test
        void shouldServeParallelClientsWithoutLostUpdates() throws Exception {
            // given
            startServer(ConnectionMode.CONCURRENT);
            int clients = 20;
            int keysPerClient = 50;
            ExecutorService pool = Executors.newFixedThreadPool(clients);
            CountDownLatch ready = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();

            // when
            for (int c = 0; c < clients; c++) {
                int id = c;
                futures.add(pool.submit(() -> {
                    try (RedisClient client = new RedisClient("127.0.0.1", server.getLocalPort())) {
                        ready.await();
                        for (int i = 0; i < keysPerClient; i++) {
                            String key = "client" + id + ":" + i;
                            assertThat(client.set(key, "value-" + key)).isEqualTo(Reply.ok());
                            assertThat(client.get(key)).isEqualTo("value-" + key);
                        }
                    }
                    return null;
                }));
            }
            ready.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            pool.shutdown();

            // then
            assertThat(server.getStorageService().size()).isEqualTo(clients * keysPerClient);
        }

        @Test
        void shouldHoldSecondClientUntilFirstDisconnectsInSequentialMode() throws Exception {
            startServer(ConnectionMode.SEQUENTIAL);

            try (Socket first = connect(); Socket second = connect()) {
                send(first, "*3\r\n$3\r\nSET\r\n$1\r\na\r\n$1\r\n1\r\n");
                assertThat(receive(first, "+OK\r\n")).isEqualTo("+OK\r\n");

                // the second connection sits in the backlog and gets no reply yet
                send(second, "*2\r\n$3\r\nGET\r\n$1\r\na\r\n");
                second.setSoTimeout(300);
                InputStream secondIn = second.getInputStream();
                assertThatThrownBy(secondIn::read).isInstanceOf(SocketTimeoutException.class);

                first.close();

                second.setSoTimeout(5000);
                assertThat(receive(second, "$1\r\n1\r\n")).isEqualTo("$1\r\n1\r\n");
            }
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void shouldStopAcceptLoopAndOpenConnectionsOnClose() throws Exception {
            startServer(ConnectionMode.CONCURRENT);

            try (Socket socket = connect()) {
                send(socket, "*2\r\n$3\r\nGET\r\n$1\r\na\r\n");
                assertThat(receive(socket, "$-1\r\n")).isEqualTo("$-1\r\n");

                server.close();
                acceptThread.join(5000);

                assertThat(acceptThread.isAlive()).isFalse();
                assertThat(socket.getInputStream().read()).isEqualTo(-1);
            }
        }

        @Test
        void shouldRejectBindingTwice() throws Exception {
            startServer(ConnectionMode.SEQUENTIAL);

            assertThatThrownBy(() -> server.bind()).isInstanceOf(IllegalStateException.class);
        }
    }
}
