package service;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpirySweeperTest {

    @Test
    void shouldRemoveExpiredKeysWithoutAccess() {
        // given
        MutableClock clock = new MutableClock();
        StorageService storage = new StorageService(clock);
        storage.set("a", "1".getBytes(StandardCharsets.UTF_8), 1);
        storage.set("b", "2".getBytes(StandardCharsets.UTF_8));
        ExpirySweeper sweeper = new ExpirySweeper(storage, 1000);

        // when
        clock.advance(Duration.ofSeconds(2));
        sweeper.sweep();

        // then
        assertThat(storage.exists("a")).isFalse();
        assertThat(storage.exists("b")).isTrue();
    }

    @Test
    void shouldSweepPeriodicallyOnceStarted() throws Exception {
        // given
        MutableClock clock = new MutableClock();
        AtomicInteger removedBySweeper = new AtomicInteger();
        StorageService storage = new StorageService(clock) {
            @Override
            public int cleanExpiredKeys() {
                int removed = super.cleanExpiredKeys();
                removedBySweeper.addAndGet(removed);
                return removed;
            }
        };
        for (int i = 0; i < 10; i++) {
            storage.set("k" + i, new byte[]{1}, 1);
        }
        clock.advance(Duration.ofSeconds(5));

        // when
        try (ExpirySweeper sweeper = new ExpirySweeper(storage, 10)) {
            sweeper.start();
            sweeper.start();

            long deadline = System.currentTimeMillis() + 5000;
            while (removedBySweeper.get() < 10 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
        }

        // then
        assertThat(removedBySweeper.get()).isEqualTo(10);
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> new ExpirySweeper(new StorageService(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
