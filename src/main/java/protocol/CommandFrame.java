package protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 디코딩이 끝난 하나의 명령어 프레임 (bulk string 배열)
 * 첫 번째 인자는 명령어 이름, 나머지는 피연산자입니다.
 */
public final class CommandFrame {

    private final List<byte[]> arguments;

    public CommandFrame(List<byte[]> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("command frame must have at least one argument");
        }
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public static CommandFrame of(String... arguments) {
        List<byte[]> parts = new ArrayList<>(arguments.length);
        for (String argument : arguments) {
            parts.add(argument.getBytes(StandardCharsets.UTF_8));
        }
        return new CommandFrame(parts);
    }

    /**
     * 명령어 이름을 대문자로 정규화하여 반환합니다.
     */
    public String getName() {
        return getRawName().toUpperCase(Locale.ROOT);
    }

    /**
     * 클라이언트가 보낸 그대로의 명령어 이름
     */
    public String getRawName() {
        return getString(0);
    }

    /**
     * 명령어 이름을 제외한 인자 개수
     */
    public int getArgumentCount() {
        return arguments.size() - 1;
    }

    /**
     * 명령어 이름을 제외한 i번째 인자의 원본 바이트
     */
    public byte[] getArgument(int index) {
        return arguments.get(index + 1);
    }

    public String getArgumentAsString(int index) {
        return new String(getArgument(index), StandardCharsets.UTF_8);
    }

    public List<byte[]> getElements() {
        return arguments;
    }

    private String getString(int index) {
        return new String(arguments.get(index), StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(getString(i));
        }
        return sb.append(']').toString();
    }
}
