package org.brown.sitepool.pool;

import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.site.SitePoolExhaustedException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * 할당 가능한 슬롯 번호(1..N) 관리
 *
 * LIFO 순서로 꺼낸다. 가장 최근에 반환된 슬롯을 먼저 재사용하면
 * 백엔드에 아직 살아 있는(warm) 사이트를 다시 쓸 가능성이 높다.
 * 한 슬롯 번호는 레지스트리에 최대 한 번만 존재한다.
 */
@Slf4j
public class SlotRegistry {

    private final int size;
    private final LinkedBlockingDeque<Integer> available = new LinkedBlockingDeque<>();

    public SlotRegistry(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1: " + size);
        }
        this.size = size;
        // 처음에는 1번부터 꺼내지도록 1..N 순서로 채운다
        for (int index = 1; index <= size; index++) {
            available.addLast(index);
        }
    }

    /**
     * 사용 가능한 슬롯을 하나 꺼낸다. 없으면 바로 empty를 반환한다.
     */
    public OptionalInt tryTake() {
        Integer index = available.pollFirst();
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    /**
     * 사용 가능한 슬롯을 하나 꺼낸다. 없으면 반환될 때까지 최대 timeout 동안 기다린다.
     *
     * @throws SitePoolExhaustedException timeout 안에 반환된 슬롯이 없는 경우
     */
    public int take(Duration timeout) throws InterruptedException {
        Integer index = available.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (index == null) {
            throw new SitePoolExhaustedException(String.format(
                    "No site slot was released within %s (pool size %d, all slots in use or discarded)",
                    timeout, size));
        }
        return index;
    }

    /**
     * 슬롯을 다시 사용 가능 상태로 되돌린다.
     * 범위를 벗어났거나 이미 사용 가능한 슬롯은 무시한다.
     *
     * @return 실제로 반환되었으면 true
     */
    public synchronized boolean release(int index) {
        if (index < 1 || index > size) {
            log.warn("Ignoring release of out-of-range slot {} (pool size {})", index, size);
            return false;
        }
        if (available.contains(index)) {
            log.warn("Ignoring duplicate release of slot {}", index);
            return false;
        }
        available.offerFirst(index);
        return true;
    }

    /**
     * 현재 사용 가능한 슬롯 수
     */
    public int available() {
        return available.size();
    }

    public int size() {
        return size;
    }

    /**
     * 사용 가능한 슬롯 목록 (다음에 꺼낼 순서대로)
     */
    public List<Integer> snapshot() {
        return new ArrayList<>(available);
    }
}
