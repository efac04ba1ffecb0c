package config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * 서버 설정을 관리하는 클래스
 */
@Slf4j
@Getter
@Setter
@ToString
public class ServerConfig {

    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;
    public static final long DEFAULT_SWEEP_INTERVAL_MILLIS = 1000;

    private String host = DEFAULT_HOST;
    private int port = DEFAULT_PORT;
    private ConnectionMode connectionMode = ConnectionMode.CONCURRENT;
    private long sweepIntervalMillis = DEFAULT_SWEEP_INTERVAL_MILLIS;  // 0이면 백그라운드 정리 비활성화

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다.
     * 잘못된 값은 로그로 남기고 기존 값을 유지합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--host":
                    if (i + 1 < args.length) {
                        this.host = args[++i];
                        log.info("명령행에서 호스트 설정: {}", this.host);
                    }
                    break;
                case "--port":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        try {
                            int parsed = Integer.parseInt(value);
                            if (parsed < 0 || parsed > 65535) {
                                log.warn("잘못된 포트 번호: {}", value);
                            } else {
                                this.port = parsed;
                                log.info("명령행에서 포트 설정: {}", this.port);
                            }
                        } catch (NumberFormatException e) {
                            log.warn("잘못된 포트 번호: {}", value);
                        }
                    }
                    break;
                case "--mode":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        try {
                            this.connectionMode = ConnectionMode.fromString(value);
                            log.info("명령행에서 연결 처리 방식 설정: {}", this.connectionMode);
                        } catch (IllegalArgumentException e) {
                            log.warn("잘못된 --mode 값: {} (sequential 또는 concurrent)", value);
                        }
                    }
                    break;
                case "--sweep-interval":
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        try {
                            long parsed = Long.parseLong(value);
                            if (parsed < 0) {
                                log.warn("잘못된 정리 주기: {}", value);
                            } else {
                                this.sweepIntervalMillis = parsed;
                                log.info("명령행에서 만료 키 정리 주기 설정: {} ms", this.sweepIntervalMillis);
                            }
                        } catch (NumberFormatException e) {
                            log.warn("잘못된 정리 주기: {}", value);
                        }
                    }
                    break;
                default:
                    log.warn("알 수 없는 옵션 무시: {}", args[i]);
                    break;
            }
        }
    }

    public boolean isSweepEnabled() {
        return sweepIntervalMillis > 0;
    }
}
