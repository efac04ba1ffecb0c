package service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 주기적으로 만료된 키를 정리하는 백그라운드 작업
 * GET이 항상 만료 여부를 다시 확인하므로 정확성과는 무관한 메모리 정리용입니다.
 */
@Slf4j
public class ExpirySweeper implements AutoCloseable {

    private final StorageService storageService;
    private final long intervalMillis;
    private ScheduledExecutorService scheduler;

    public ExpirySweeper(StorageService storageService, long intervalMillis) {
        if (intervalMillis <= 0) {
            throw new IllegalArgumentException("sweep interval must be positive: " + intervalMillis);
        }
        this.storageService = storageService;
        this.intervalMillis = intervalMillis;
    }

    /**
     * 정리 작업을 시작합니다. 이미 시작된 경우 아무 것도 하지 않습니다.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "expiry-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Expiry sweeper started (interval {} ms)", intervalMillis);
    }

    /**
     * 한 번의 정리를 수행합니다.
     */
    void sweep() {
        try {
            int removed = storageService.cleanExpiredKeys();
            if (removed > 0) {
                log.debug("Sweeper removed {} expired keys", removed);
            }
        } catch (RuntimeException e) {
            // 예외가 새어 나가면 스케줄이 조용히 취소되므로 여기서 기록만 합니다
            log.error("Expiry sweep failed", e);
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        scheduler = null;
        log.info("Expiry sweeper stopped");
    }
}
