package client;

import lombok.extern.slf4j.Slf4j;
import protocol.Reply;
import protocol.RespProtocol;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;

/**
 * 블로킹 방식의 RESP 클라이언트
 * 명령어 하나를 보내면 정확히 하나의 응답을 읽어 돌려줍니다. 스레드 안전하지 않습니다.
 */
@Slf4j
public class RedisClient implements AutoCloseable {

    private final Socket socket;
    private final InputStream inputStream;
    private final OutputStream outputStream;

    public RedisClient(String host, int port) throws IOException {
        this(new Socket(host, port));
    }

    public RedisClient(Socket socket) throws IOException {
        this.socket = socket;
        this.inputStream = new BufferedInputStream(socket.getInputStream());
        this.outputStream = socket.getOutputStream();
    }

    /**
     * 명령어를 RESP 배열로 보내고 응답 하나를 읽습니다.
     * 에러 응답은 예외가 아니라 {@link Reply.Type#ERROR} 응답으로 반환됩니다.
     */
    public Reply execute(String... args) throws IOException {
        if (args.length == 0) {
            throw new IllegalArgumentException("command must not be empty");
        }
        outputStream.write(RespProtocol.createRespArray(args));
        outputStream.flush();
        Reply reply = RespProtocol.readReply(inputStream);
        log.debug("{} -> {}", args[0], reply);
        return reply;
    }

    public Reply set(String key, String value) throws IOException {
        return execute("SET", key, value);
    }

    public Reply set(String key, String value, long ttlSeconds) throws IOException {
        return execute("SET", key, value, "EX", String.valueOf(ttlSeconds));
    }

    /**
     * @return 값, 키가 없으면 null
     * @throws IOException 에러 응답을 받은 경우 포함
     */
    public String get(String key) throws IOException {
        Reply reply = execute("GET", key);
        if (reply.isError()) {
            throw new IOException(reply.getMessage());
        }
        return reply.getValueAsString();
    }

    public Reply expire(String key, long seconds) throws IOException {
        return execute("EXPIRE", key, String.valueOf(seconds));
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
