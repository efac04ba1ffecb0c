package config;

import java.util.Locale;

/**
 * 연결 처리 방식. 서버 시작 시 한 번 정해지며 실행 중에는 바뀌지 않습니다.
 */
public enum ConnectionMode {
    /** 한 번에 하나의 연결만 처리하고, 나머지는 OS backlog에서 대기 */
    SEQUENTIAL,
    /** 연결마다 독립된 작업으로 병렬 처리 */
    CONCURRENT;

    public static ConnectionMode fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
