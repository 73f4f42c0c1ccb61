package org.brown.sitepool.pool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 사이트 풀 상태 스냅샷 (상태 API 응답용)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStatus {

    private int poolSize;

    private String sitePrefix;

    /**
     * 사용 가능한 슬롯 (다음에 할당될 순서)
     */
    private List<Integer> availableSlots;

    /**
     * 실패가 반복되어 이번 프로세스 동안 제외된 슬롯
     */
    private List<Integer> discardedSlots;

    /**
     * 미리 준비되어 대기 중인 사이트 이름, 없으면 null
     */
    private String pendingSite;

    /**
     * 백그라운드 준비가 진행 중인지
     */
    private boolean prefetchInProgress;

    private long warmAcquisitions;

    private long coldAcquisitions;

    private Instant lastAcquiredAt;
}
