package org.brown.sitepool.pool;

import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.metrics.PoolMetricsPublisher;
import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.SitePoolException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Prefetch 기반 사이트 풀 구현
 *
 * 다음 사이트 하나를 미리 준비해 두었다가 acquire() 요청에 바로 넘겨주고,
 * 넘겨주는 즉시 그다음 사이트 준비를 백그라운드에서 시작한다.
 *
 * 동시성:
 * - pending(미리 준비된 사이트)은 pendingLock 으로만 읽고 쓴다.
 * - 백그라운드 준비는 준비가 끝날 때까지 pendingLock 을 잡고 있으므로 동시에 하나만 실행된다.
 *   준비 중에 들어온 acquire()는 그 결과를 기다렸다가 받는다 (최대 pendingWaitTimeout).
 * - 슬롯은 SlotRegistry 에서 꺼내므로 동시에 할당된 두 사이트가 같은 슬롯을 갖지 않는다.
 */
@Slf4j
@Service
public class PrefetchingSitePool implements SitePool {

    private final SiteFactory siteFactory;
    private final PoolMetricsPublisher metricsPublisher;
    private final SitePoolProperties sitePoolProperties;
    private final Executor prefetchExecutor;
    private final SlotRegistry slotRegistry;

    private final ReentrantLock pendingLock = new ReentrantLock(true);
    private volatile Site pending;  // guarded by pendingLock

    private final Object recycleLock = new Object();
    private final Set<Integer> discardedSlots = ConcurrentHashMap.newKeySet();
    private final AtomicLong warmAcquisitions = new AtomicLong();
    private final AtomicLong coldAcquisitions = new AtomicLong();
    private volatile Instant lastAcquiredAt;

    public PrefetchingSitePool(SiteFactory siteFactory,
                               PoolMetricsPublisher metricsPublisher,
                               SitePoolProperties sitePoolProperties,
                               @Qualifier("sitePrefetchExecutor") Executor prefetchExecutor) {
        this.siteFactory = siteFactory;
        this.metricsPublisher = metricsPublisher;
        this.sitePoolProperties = sitePoolProperties;
        this.prefetchExecutor = prefetchExecutor;
        this.slotRegistry = new SlotRegistry(sitePoolProperties.getPool().getSize());

        log.info("Site pool created: size={}, prefix={}",
                slotRegistry.size(), sitePoolProperties.getPool().getSitePrefix());
    }

    /**
     * 애플리케이션 시작 시 첫 사이트 미리 준비 (설정된 경우)
     */
    @EventListener(ApplicationReadyEvent.class)
    public void prefetchOnStartup() {
        if (sitePoolProperties.getPool().isPrefetchOnStartup()) {
            log.info("[PREFETCH] Preparing first site on startup");
            prefetchNext();
        }
    }

    @Override
    public Site acquire() {
        long startTime = System.currentTimeMillis();

        Site site = takePending();
        AllocationPath path;
        if (site != null) {
            path = AllocationPath.WARM;
            warmAcquisitions.incrementAndGet();
        } else {
            path = AllocationPath.COLD;
            site = prepareInForeground();
            coldAcquisitions.incrementAndGet();
        }

        long latency = System.currentTimeMillis() - startTime;
        lastAcquiredAt = Instant.now();
        log.info("[ACQUIRE][{}] Site {} (slot {}) acquired in {}ms", path, site.getName(), site.getSlotIndex(), latency);

        prefetchNext();
        metricsPublisher.publishAcquireLatency(path, latency);
        return site;
    }

    @Override
    public void report(Site site, boolean success) {
        if (site == null) {
            log.warn("[REPORT] Ignoring report for null site (success={})", success);
            return;
        }
        recycle(site.getSlotIndex(), site.getName(), success);
    }

    @Override
    public PoolStatus status() {
        Site pendingSite = pending;
        List<Integer> discarded = new ArrayList<>(discardedSlots);
        Collections.sort(discarded);

        return PoolStatus.builder()
                .poolSize(slotRegistry.size())
                .sitePrefix(sitePoolProperties.getPool().getSitePrefix())
                .availableSlots(slotRegistry.snapshot())
                .discardedSlots(discarded)
                .pendingSite(pendingSite != null ? pendingSite.getName() : null)
                .prefetchInProgress(pendingLock.isLocked())
                .warmAcquisitions(warmAcquisitions.get())
                .coldAcquisitions(coldAcquisitions.get())
                .lastAcquiredAt(lastAcquiredAt)
                .build();
    }

    /**
     * 미리 준비된 사이트를 꺼내고 비운다.
     * 백그라운드 준비가 진행 중이면 끝날 때까지 (최대 pendingWaitTimeout) 기다린다.
     */
    private Site takePending() {
        Duration timeout = sitePoolProperties.getPool().getPendingWaitTimeout();
        boolean locked;
        try {
            locked = pendingLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SitePoolException("Interrupted while waiting for the prefetched site", e);
        }

        if (!locked) {
            log.warn("[ACQUIRE] Prefetch still running after {}, preparing a site directly", timeout);
            return null;
        }

        try {
            Site site = pending;
            pending = null;
            return site;
        } finally {
            pendingLock.unlock();
        }
    }

    /**
     * 요청 스레드에서 직접 사이트 준비 (cold path)
     */
    private Site prepareInForeground() {
        int slotIndex;
        try {
            slotIndex = slotRegistry.take(sitePoolProperties.getPool().getSlotWaitTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SitePoolException("Interrupted while waiting for a free site slot", e);
        }

        try {
            return siteFactory.prepare(slotIndex);
        } catch (RuntimeException e) {
            log.error("[ACQUIRE][COLD][FAIL] Preparing {} failed", siteFactory.siteName(slotIndex), e);
            recycle(slotIndex, siteFactory.siteName(slotIndex), false);
            throw e;
        }
    }

    /**
     * 다음 사이트 준비를 백그라운드 작업으로 등록 (결과를 기다리지 않음)
     */
    void prefetchNext() {
        try {
            prefetchExecutor.execute(() -> {
                try {
                    preparePending();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("[PREFETCH] Interrupted, stopping");
                } catch (Exception e) {
                    log.error("[PREFETCH][FAIL] Unexpected error while preparing next site", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[PREFETCH] Prefetch task rejected (pool shutting down?)", e);
        }
    }

    /**
     * pendingLock 을 잡은 채로 다음 사이트를 준비해서 pending 에 넣는다.
     * 이미 준비된 사이트가 있거나 남은 슬롯이 없으면 아무것도 하지 않는다.
     */
    void preparePending() throws InterruptedException {
        pendingLock.lockInterruptibly();
        try {
            if (pending != null) {
                log.debug("[PREFETCH] Site {} is already pending, skipping", pending.getName());
                return;
            }

            OptionalInt slot = slotRegistry.tryTake();
            if (slot.isEmpty()) {
                log.debug("[PREFETCH] No free slot, skipping prefetch");
                return;
            }

            int slotIndex = slot.getAsInt();
            try {
                pending = siteFactory.prepare(slotIndex);
                log.info("[PREFETCH] Site {} is ready for the next acquire", pending.getName());
            } catch (RuntimeException e) {
                log.error("[PREFETCH][FAIL] Preparing {} failed, next acquire will prepare directly",
                        siteFactory.siteName(slotIndex), e);
                recycle(slotIndex, siteFactory.siteName(slotIndex), false);
            }
        } finally {
            pendingLock.unlock();
        }
    }

    /**
     * 성공했거나 남은 슬롯이 1개 이하면 반환, 아니면 폐기
     */
    private void recycle(int slotIndex, String siteName, boolean success) {
        synchronized (recycleLock) {
            int free = slotRegistry.available();
            if (success || free <= 1) {
                slotRegistry.release(slotIndex);
                discardedSlots.remove(slotIndex);
                log.info("[REPORT] Returned slot {} ({}) to pool, success={}, free={}",
                        slotIndex, siteName, success, slotRegistry.available());
                return;
            }

            discardedSlots.add(slotIndex);
            log.warn("[REPORT][DISCARD] Removing site {} (slot {}) from pool, free={}", siteName, slotIndex, free);
        }
        metricsPublisher.publishSlotDiscarded(slotIndex);
    }
}
