package protocol;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.nio.charset.StandardCharsets;

/**
 * 명령어 하나에 대한 응답 값
 * OK, bulk string, nil, error 중 하나입니다.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Reply {

    public enum Type {
        OK,
        BULK,
        NIL,
        ERROR
    }

    private static final Reply OK_REPLY = new Reply(Type.OK, null, null);
    private static final Reply NIL_REPLY = new Reply(Type.NIL, null, null);

    private final Type type;
    private final byte[] value;
    private final String message;

    public static Reply ok() {
        return OK_REPLY;
    }

    public static Reply nil() {
        return NIL_REPLY;
    }

    public static Reply bulk(byte[] value) {
        if (value == null) {
            return NIL_REPLY;
        }
        return new Reply(Type.BULK, value, null);
    }

    public static Reply bulk(String value) {
        return value == null ? NIL_REPLY : bulk(value.getBytes(StandardCharsets.UTF_8));
    }

    public static Reply error(String message) {
        return new Reply(Type.ERROR, null, message);
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    /**
     * bulk 값을 UTF-8 문자열로 반환합니다. bulk가 아니면 null.
     */
    public String getValueAsString() {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        switch (type) {
            case OK:
                return "OK";
            case NIL:
                return "(nil)";
            case ERROR:
                return "(error) " + message;
            default:
                return "\"" + getValueAsString() + "\"";
        }
    }
}
