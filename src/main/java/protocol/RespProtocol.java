package protocol;

import org.apache.commons.io.IOUtils;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Redis RESP 프로토콜 응답 생성 및 클라이언트 측 응답 파싱을 담당하는 클래스
 */
public final class RespProtocol {

    public static final byte[] OK_RESPONSE = "+OK\r\n".getBytes(StandardCharsets.US_ASCII);
    public static final byte[] NULL_BULK_STRING = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private static final byte[] CRLF = {'\r', '\n'};
    private static final int MAX_LINE_LENGTH = 64 * 1024;

    private RespProtocol() {
    }

    /**
     * 응답 값을 RESP 바이트로 인코딩합니다.
     */
    public static byte[] encode(Reply reply) {
        switch (reply.getType()) {
            case OK:
                return OK_RESPONSE.clone();
            case NIL:
                return NULL_BULK_STRING.clone();
            case ERROR:
                return createErrorResponse(reply.getMessage());
            case BULK:
                return createBulkString(reply.getValue());
            default:
                throw new IllegalStateException("Unknown reply type: " + reply.getType());
        }
    }

    /**
     * RESP bulk string 형식으로 인코딩합니다. 길이는 바이트 기준입니다.
     */
    public static byte[] createBulkString(byte[] value) {
        if (value == null) {
            return NULL_BULK_STRING.clone();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length + 16);
        writeBulkString(out, value);
        return out.toByteArray();
    }

    /**
     * 에러 메시지를 RESP 형식으로 생성합니다. 메시지 안의 CR/LF는 공백으로 바꿉니다.
     */
    public static byte[] createErrorResponse(String message) {
        String safe = message == null ? "ERR" : sanitize(message);
        return ("-" + safe + "\r\n").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * 명령어 인자들을 bulk string 배열로 인코딩합니다.
     */
    public static byte[] createRespArray(List<byte[]> elements) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeAscii(out, "*" + elements.size());
        out.write(CRLF, 0, CRLF.length);
        for (byte[] element : elements) {
            writeBulkString(out, element);
        }
        return out.toByteArray();
    }

    public static byte[] createRespArray(String... elements) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeAscii(out, "*" + elements.length);
        out.write(CRLF, 0, CRLF.length);
        for (String element : elements) {
            writeBulkString(out, element.getBytes(StandardCharsets.UTF_8));
        }
        return out.toByteArray();
    }

    /**
     * 스트림에서 응답 하나를 정확히 읽어옵니다. (+, -, $ 타입만 지원)
     * @throws EOFException 응답 도중 연결이 끊긴 경우
     * @throws ProtocolException 지원하지 않거나 잘못된 형식의 응답인 경우
     */
    public static Reply readReply(InputStream in) throws IOException {
        String line = readLine(in);
        if (line.isEmpty()) {
            throw new ProtocolException("empty reply line");
        }
        char prefix = line.charAt(0);
        String body = line.substring(1);
        switch (prefix) {
            case '+':
                if ("OK".equals(body)) {
                    return Reply.ok();
                }
                return Reply.bulk(body);
            case '-':
                return Reply.error(body);
            case '$':
                int length;
                try {
                    length = Integer.parseInt(body);
                } catch (NumberFormatException e) {
                    throw new ProtocolException("invalid bulk length: " + body);
                }
                if (length == -1) {
                    return Reply.nil();
                }
                if (length < 0) {
                    throw new ProtocolException("invalid bulk length: " + body);
                }
                byte[] payload = IOUtils.readFully(in, length);
                byte[] terminator = IOUtils.readFully(in, 2);
                if (terminator[0] != '\r' || terminator[1] != '\n') {
                    throw new ProtocolException("expected CRLF after bulk string");
                }
                return Reply.bulk(payload);
            default:
                throw new ProtocolException("unsupported reply type '" + prefix + "'");
        }
    }

    /**
     * 입력 스트림에서 CRLF로 끝나는 한 줄을 읽습니다 (CRLF 제외).
     */
    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\r') {
                int nextByte = in.read();
                if (nextByte == -1) {
                    break;
                }
                if (nextByte == '\n') {
                    return bos.toString(StandardCharsets.UTF_8);
                }
                bos.write(b);
                bos.write(nextByte);
            } else {
                bos.write(b);
            }
            if (bos.size() > MAX_LINE_LENGTH) {
                throw new ProtocolException("reply line too long");
            }
        }
        throw new EOFException("connection closed while reading reply");
    }

    private static void writeBulkString(ByteArrayOutputStream out, byte[] value) {
        writeAscii(out, "$" + value.length);
        out.write(CRLF, 0, CRLF.length);
        out.write(value, 0, value.length);
        out.write(CRLF, 0, CRLF.length);
    }

    private static void writeAscii(ByteArrayOutputStream out, String text) {
        byte[] bytes = text.getBytes(StandardCharsets.US_ASCII);
        out.write(bytes, 0, bytes.length);
    }

    private static String sanitize(String message) {
        return message.replace('\r', ' ').replace('\n', ' ');
    }
}
