package org.brown.sitepool.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.pool.PoolStatus;
import org.brown.sitepool.pool.SitePool;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 사이트 풀 상태 확인 API
 *
 * 엔드포인트:
 * - GET /health: 간단한 헬스체크
 * - GET /status: 슬롯/prefetch 상태
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class PoolStatusController {

    private final SitePool sitePool;
    private final SitePoolProperties sitePoolProperties;

    /**
     * 간단한 헬스체크
     *
     * @return "OK"
     */
    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    /**
     * 상세한 풀 상태
     *
     * @return 풀 상태 정보 (JSON)
     */
    @GetMapping("/status")
    public Map<String, Object> status() {
        PoolStatus poolStatus = sitePool.status();

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("application", "SitePool");
        status.put("poolSize", poolStatus.getPoolSize());
        status.put("sitePrefix", poolStatus.getSitePrefix());
        status.put("availableSlots", poolStatus.getAvailableSlots());
        status.put("discardedSlots", poolStatus.getDiscardedSlots());
        status.put("pendingSite", poolStatus.getPendingSite());
        status.put("prefetchInProgress", poolStatus.isPrefetchInProgress());
        status.put("warmAcquisitions", poolStatus.getWarmAcquisitions());
        status.put("coldAcquisitions", poolStatus.getColdAcquisitions());
        status.put("lastAcquiredAt", poolStatus.getLastAcquiredAt());
        status.put("metricsEnabled", sitePoolProperties.getMetrics().isEnabled());

        log.debug("Status check requested");
        return status;
    }
}
