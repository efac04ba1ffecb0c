package service;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 키-값 저장소와 만료 시간 관리를 담당하는 서비스 클래스
 *
 * <p>값 맵과 만료 시간 맵은 하나의 락으로 함께 보호되므로, SET의 값 쓰기와
 * 만료 시간 쓰기(또는 제거)는 다른 스레드에게 항상 한 번에 보입니다.
 * 만료 시각이 현재 시각과 같거나 지났으면 그 키는 존재하지 않는 것으로 취급합니다.
 *
 * <p>키는 명령어 인자 바이트를 UTF-8로 디코딩한 문자열입니다. 값은 바이트 그대로 저장합니다.
 */
@Slf4j
public class StorageService {

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    // 키-값 저장소
    private final Map<String, byte[]> keyValueStore = new HashMap<>();
    // 키별 만료 시간 저장소 (밀리초 단위 timestamp)
    private final Map<String, Long> keyExpiryStore = new HashMap<>();

    public StorageService() {
        this(Clock.systemUTC());
    }

    public StorageService(Clock clock) {
        this.clock = clock;
    }

    /**
     * 키-값을 저장합니다. 기존 만료 시간은 제거됩니다.
     */
    public void set(String key, byte[] value) {
        byte[] copy = value.clone();
        lock.lock();
        try {
            keyValueStore.put(key, copy);
            keyExpiryStore.remove(key);
        } finally {
            lock.unlock();
        }
        log.debug("Stored: {} ({} bytes)", key, copy.length);
    }

    /**
     * 만료 시간(초)과 함께 키-값을 저장합니다.
     * @throws IllegalArgumentException ttlSeconds가 0 이하인 경우
     */
    public void set(String key, byte[] value, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttl must be a positive number of seconds: " + ttlSeconds);
        }
        byte[] copy = value.clone();
        lock.lock();
        try {
            long expiryTimeMs = expiryFromNow(ttlSeconds);
            keyValueStore.put(key, copy);
            keyExpiryStore.put(key, expiryTimeMs);
            log.debug("Stored with expiry: {} ({} bytes, expires at {})", key, copy.length, expiryTimeMs);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 키에 해당하는 값을 가져옵니다. 만료된 키는 이 시점에 삭제됩니다.
     * @return 값의 복사본, 없거나 만료되었으면 null
     */
    public byte[] get(String key) {
        lock.lock();
        try {
            if (evictIfExpired(key)) {
                return null;
            }
            byte[] value = keyValueStore.get(key);
            return value == null ? null : value.clone();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 이미 존재하는 키에 만료 시간(초)을 설정합니다.
     * 0 이하의 값이면 키는 즉시 만료되어 삭제됩니다.
     * @return 키가 존재했으면 true, 없으면 false (아무 것도 하지 않음)
     */
    public boolean expire(String key, long ttlSeconds) {
        lock.lock();
        try {
            if (evictIfExpired(key) || !keyValueStore.containsKey(key)) {
                return false;
            }
            if (ttlSeconds <= 0) {
                removeEntry(key);
                log.debug("Expired immediately: {}", key);
            } else {
                keyExpiryStore.put(key, expiryFromNow(ttlSeconds));
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 키가 존재하는지 확인합니다.
     */
    public boolean exists(String key) {
        lock.lock();
        try {
            return !evictIfExpired(key) && keyValueStore.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 키를 삭제합니다.
     */
    public boolean delete(String key) {
        lock.lock();
        try {
            return !evictIfExpired(key) && removeEntry(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 저장소를 초기화합니다.
     */
    public void clear() {
        lock.lock();
        try {
            keyValueStore.clear();
            keyExpiryStore.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 만료된 키들을 정리합니다.
     * @return 삭제된 키 개수
     */
    public int cleanExpiredKeys() {
        List<String> expiredKeys = new ArrayList<>();
        lock.lock();
        try {
            long currentTime = clock.millis();
            Iterator<Map.Entry<String, Long>> it = keyExpiryStore.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Long> entry = it.next();
                if (entry.getValue() <= currentTime) {
                    keyValueStore.remove(entry.getKey());
                    it.remove();
                    expiredKeys.add(entry.getKey());
                }
            }
        } finally {
            lock.unlock();
        }
        if (!expiredKeys.isEmpty()) {
            log.debug("Expired keys removed: {}", expiredKeys);
        }
        return expiredKeys.size();
    }

    /**
     * 만료되지 않은 키의 개수를 반환합니다.
     */
    public int size() {
        cleanExpiredKeys();
        lock.lock();
        try {
            return keyValueStore.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 만료된 키이면 삭제하고 true를 반환합니다. 락을 잡은 상태에서만 호출합니다.
     */
    private boolean evictIfExpired(String key) {
        Long expiryTime = keyExpiryStore.get(key);
        if (expiryTime == null || expiryTime > clock.millis()) {
            return false;
        }
        removeEntry(key);
        log.debug("Key expired and removed: {}", key);
        return true;
    }

    private boolean removeEntry(String key) {
        keyExpiryStore.remove(key);
        return keyValueStore.remove(key) != null;
    }

    private long expiryFromNow(long ttlSeconds) {
        long ttlMs = TimeUnit.SECONDS.toMillis(ttlSeconds);
        long now = clock.millis();
        // 매우 큰 TTL은 사실상 만료되지 않는 것으로 고정
        return ttlMs > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + ttlMs;
    }
}
