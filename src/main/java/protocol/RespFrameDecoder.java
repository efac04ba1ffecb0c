package protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 연결 하나가 소유하는 RESP 프레임 디코더
 * TCP로 쪼개지거나 여러 개가 한 번에 도착한 바이트를 버퍼에 모아
 * 완성된 명령어 프레임을 하나씩 꺼냅니다.
 *
 * <p>프레임이 아직 완성되지 않았으면 버퍼를 건드리지 않고 빈 값을 반환하며,
 * 형식 자체가 잘못되었거나 버퍼 한도를 넘는 경우에만 {@link ProtocolException}을 던집니다.
 * 스레드 안전하지 않습니다.
 */
public class RespFrameDecoder {

    public static final int MAX_MULTIBULK_LENGTH = 1024 * 1024;
    public static final int MAX_BULK_LENGTH = 512 * 1024 * 1024;
    public static final int MAX_HEADER_LINE_LENGTH = 64 * 1024;
    // 연결 하나가 쌓아둘 수 있는 미처리 바이트 (Redis의 query buffer 한도와 같음)
    public static final int MAX_BUFFER_LENGTH = 1024 * 1024 * 1024;

    private static final int INITIAL_CAPACITY = 4096;
    private static final int MAX_PRESIZED_ELEMENTS = 1024;

    private final int maxBufferLength;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int readIndex = 0;
    private int writeIndex = 0;

    // 읽는 중인 프레임: 이미 완성된 원소와 다음 원소의 시작 위치
    private List<byte[]> pendingElements;
    private int expectedElements;
    private int cursor;

    public RespFrameDecoder() {
        this(MAX_BUFFER_LENGTH);
    }

    /**
     * @param maxBufferLength 소비되지 않은 채 버퍼에 쌓일 수 있는 최대 바이트 수
     */
    public RespFrameDecoder(int maxBufferLength) {
        if (maxBufferLength <= 0) {
            throw new IllegalArgumentException("maxBufferLength must be positive: " + maxBufferLength);
        }
        this.maxBufferLength = maxBufferLength;
    }

    /**
     * 수신한 바이트를 내부 버퍼 뒤에 붙입니다.
     * @throws ProtocolException 미처리 바이트가 버퍼 한도를 넘게 되는 경우
     */
    public void feed(byte[] bytes) throws ProtocolException {
        feed(bytes, 0, bytes.length);
    }

    public void feed(byte[] bytes, int offset, int length) throws ProtocolException {
        if (length <= 0) {
            return;
        }
        if ((long) bufferedBytes() + length > maxBufferLength) {
            throw new ProtocolException("query buffer limit exceeded (" + maxBufferLength + " bytes)");
        }
        ensureWritable(length);
        System.arraycopy(bytes, offset, buffer, writeIndex, length);
        writeIndex += length;
    }

    /**
     * 버퍼 앞쪽에서 완성된 프레임 하나를 꺼냅니다.
     * 읽다 만 프레임은 이미 완성된 원소부터 이어서 읽습니다.
     * @return 완성된 프레임, 데이터가 부족하면 Optional.empty()
     * @throws ProtocolException 헤더나 길이 형식이 잘못된 경우
     */
    public Optional<CommandFrame> tryDecode() throws ProtocolException {
        while (readIndex < writeIndex) {
            if (pendingElements == null) {
                if (!readArrayHeader()) {
                    return Optional.empty();
                }
                // 빈 배열은 프레임을 만들지 않고 소비만 합니다
                if (expectedElements == 0) {
                    finishFrame();
                    continue;
                }
            }

            while (pendingElements.size() < expectedElements) {
                if (!readBulkString()) {
                    return Optional.empty();
                }
            }

            CommandFrame frame = new CommandFrame(pendingElements);
            finishFrame();
            return Optional.of(frame);
        }
        return Optional.empty();
    }

    /**
     * 아직 프레임으로 소비되지 않은 바이트 수
     */
    public int bufferedBytes() {
        return writeIndex - readIndex;
    }

    private boolean readArrayHeader() throws ProtocolException {
        if (buffer[readIndex] != '*') {
            throw new ProtocolException("expected '*', got '" + printable(buffer[readIndex]) + "'");
        }
        int lineEnd = findLineEnd(readIndex);
        if (lineEnd < 0) {
            return false;
        }
        long elementCount = parseLength(readIndex + 1, lineEnd, "invalid multibulk length");
        if (elementCount > MAX_MULTIBULK_LENGTH) {
            throw new ProtocolException("invalid multibulk length");
        }
        expectedElements = (int) elementCount;
        pendingElements = new ArrayList<>(Math.min(expectedElements, MAX_PRESIZED_ELEMENTS));
        cursor = lineEnd + 2;
        return true;
    }

    /**
     * cursor 위치의 bulk string 하나가 완성되어 있으면 복사하고 cursor를 넘깁니다.
     */
    private boolean readBulkString() throws ProtocolException {
        if (cursor >= writeIndex) {
            return false;
        }
        if (buffer[cursor] != '$') {
            throw new ProtocolException("expected '$', got '" + printable(buffer[cursor]) + "'");
        }
        int lineEnd = findLineEnd(cursor);
        if (lineEnd < 0) {
            return false;
        }
        long bulkLength = parseLength(cursor + 1, lineEnd, "invalid bulk length");
        if (bulkLength > MAX_BULK_LENGTH) {
            throw new ProtocolException("invalid bulk length");
        }
        int payloadStart = lineEnd + 2;
        long payloadEnd = payloadStart + bulkLength;
        if (payloadEnd + 2 > writeIndex) {
            return false;
        }
        int end = (int) payloadEnd;
        if (buffer[end] != '\r' || buffer[end + 1] != '\n') {
            throw new ProtocolException("expected CRLF after bulk string");
        }
        pendingElements.add(Arrays.copyOfRange(buffer, payloadStart, end));
        cursor = end + 2;
        return true;
    }

    private void finishFrame() {
        readIndex = cursor;
        pendingElements = null;
        expectedElements = 0;
        cursor = 0;
        compactIfDrained();
    }

    /**
     * start 위치부터 CRLF의 '\r' 위치를 찾습니다. 없으면 -1.
     */
    private int findLineEnd(int start) throws ProtocolException {
        for (int i = start; i + 1 < writeIndex; i++) {
            if (buffer[i] == '\r' && buffer[i + 1] == '\n') {
                return i;
            }
            if (i - start > MAX_HEADER_LINE_LENGTH) {
                throw new ProtocolException("header line too long");
            }
        }
        if (writeIndex - start > MAX_HEADER_LINE_LENGTH) {
            throw new ProtocolException("header line too long");
        }
        return -1;
    }

    private long parseLength(int start, int end, String error) throws ProtocolException {
        if (start >= end || end - start > 18) {
            throw new ProtocolException(error);
        }
        long value = 0;
        for (int i = start; i < end; i++) {
            byte b = buffer[i];
            if (b < '0' || b > '9') {
                throw new ProtocolException(error);
            }
            value = value * 10 + (b - '0');
        }
        return value;
    }

    /**
     * length 바이트를 더 쓸 공간을 확보합니다. 호출 전에 버퍼 한도 검사가 끝나 있어야 합니다.
     */
    private void ensureWritable(int length) {
        if ((long) writeIndex + length <= buffer.length) {
            return;
        }
        int pending = writeIndex - readIndex;
        long required = (long) pending + length;
        // 앞쪽 소비된 공간을 먼저 회수하고, 그래도 부족하면 두 배씩 늘립니다
        if (required <= buffer.length && readIndex > 0) {
            System.arraycopy(buffer, readIndex, buffer, 0, pending);
        } else {
            long capacity = Math.max(buffer.length, INITIAL_CAPACITY);
            while (capacity < required) {
                capacity *= 2;
            }
            byte[] grown = new byte[(int) Math.min(capacity, Math.max(required, maxBufferLength))];
            System.arraycopy(buffer, readIndex, grown, 0, pending);
            buffer = grown;
        }
        if (pendingElements != null) {
            cursor -= readIndex;
        }
        readIndex = 0;
        writeIndex = pending;
    }

    private void compactIfDrained() {
        if (readIndex == writeIndex) {
            readIndex = 0;
            writeIndex = 0;
        }
    }

    private static String printable(byte b) {
        if (b >= 0x20 && b < 0x7f) {
            return String.valueOf((char) b);
        }
        return String.format("\\x%02x", b & 0xff);
    }
}
