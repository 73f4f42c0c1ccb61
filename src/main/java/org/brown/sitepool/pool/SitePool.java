package org.brown.sitepool.pool;

import org.brown.sitepool.site.Site;

/**
 * 테스트 사이트 풀 인터페이스
 *
 * 미리 준비해 둔 사이트를 바로 넘겨주고, 다음 사이트는 백그라운드에서 준비하여
 * 테스트마다 사이트 생성/정리 비용을 기다리지 않게 한다.
 */
public interface SitePool {

    /**
     * 테스트에 사용할 사이트 하나를 할당한다.
     * 미리 준비된 사이트가 있으면 즉시 반환하고, 없으면 이 호출에서 직접 준비한다.
     * 어느 경우든 반환 전에 다음 사이트의 백그라운드 준비를 시작한다.
     *
     * @return 할당된 사이트
     * @throws org.brown.sitepool.site.SitePoolException 사이트 준비 실패 또는 슬롯 고갈 시
     */
    Site acquire();

    /**
     * 테스트 결과를 보고하고 사이트의 슬롯을 돌려준다.
     * 성공했거나 남은 슬롯이 1개 이하이면 슬롯을 풀에 반환하고,
     * 그 외 실패는 슬롯이 오염되었다고 보고 이번 프로세스 동안 폐기한다.
     *
     * @param site    acquire()로 받은 사이트 (null이면 무시)
     * @param success 테스트 성공 여부
     */
    void report(Site site, boolean success);

    /**
     * 현재 풀 상태
     */
    PoolStatus status();
}
