package org.brown.sitepool.site;

import java.time.Duration;
import java.util.Optional;

/**
 * 사이트 프로비저닝 백엔드 인터페이스
 *
 * 이름으로 기존 사이트를 찾거나 새 사이트를 만든다.
 * 반환되는 Site의 slotIndex는 채워지지 않으며 호출자(풀)가 설정한다.
 */
public interface SiteProvisioner {

    /**
     * 주어진 이름의 사이트가 이미 있으면 반환한다.
     *
     * @param name 사이트 이름
     * @return 기존 사이트, 없으면 empty
     */
    Optional<Site> findSite(String name);

    /**
     * 새 사이트를 생성하고 시작한다.
     *
     * @param name 사이트 이름
     * @return 생성된 사이트
     * @throws SiteOperationException 생성 실패 시
     */
    Site createSite(String name);

    /**
     * 사이트가 마지막으로 시작된 뒤 지난 시간 (장애 진단용)
     *
     * @param site 대상 사이트
     * @return 가동 시간
     * @throws SiteOperationException 조회 실패 시
     */
    Duration getUptime(Site site);
}
