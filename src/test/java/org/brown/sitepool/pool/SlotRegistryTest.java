package org.brown.sitepool.pool;

import org.brown.sitepool.site.SitePoolExhaustedException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotRegistryTest {

    @Test
    void startsWithAllSlotsInAscendingTakeOrder() {
        SlotRegistry registry = new SlotRegistry(3);

        assertThat(registry.available()).isEqualTo(3);
        assertThat(registry.snapshot()).containsExactly(1, 2, 3);
        assertThat(registry.tryTake()).hasValue(1);
        assertThat(registry.tryTake()).hasValue(2);
    }

    @Test
    void releasedSlotIsTakenFirst() {
        SlotRegistry registry = new SlotRegistry(3);
        registry.tryTake();
        registry.tryTake();

        assertThat(registry.release(1)).isTrue();

        assertThat(registry.snapshot()).containsExactly(1, 3);
        assertThat(registry.tryTake()).hasValue(1);
    }

    @Test
    void tryTakeOnEmptyRegistryReturnsEmpty() {
        SlotRegistry registry = new SlotRegistry(1);
        registry.tryTake();

        assertThat(registry.tryTake()).isEmpty();
        assertThat(registry.available()).isZero();
    }

    @Test
    void duplicateAndOutOfRangeReleasesAreIgnored() {
        SlotRegistry registry = new SlotRegistry(2);

        assertThat(registry.release(1)).isFalse();
        assertThat(registry.release(0)).isFalse();
        assertThat(registry.release(3)).isFalse();
        assertThat(registry.snapshot()).containsExactly(1, 2);
    }

    @Test
    void takeTimesOutWhenNothingIsReleased() {
        SlotRegistry registry = new SlotRegistry(1);
        registry.tryTake();

        assertThatThrownBy(() -> registry.take(Duration.ofMillis(50)))
                .isInstanceOf(SitePoolExhaustedException.class)
                .hasMessageContaining("pool size 1");
    }

    @Test
    void takeWakesUpWhenSlotIsReleased() throws Exception {
        SlotRegistry registry = new SlotRegistry(1);
        int taken = registry.tryTake().getAsInt();

        CompletableFuture<Integer> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return registry.take(Duration.ofSeconds(5));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        CompletableFuture.runAsync(() -> registry.release(taken),
                CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isEqualTo(1);
    }

    @Test
    void rejectsEmptyPool() {
        assertThatThrownBy(() -> new SlotRegistry(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
