package org.brown.sitepool.pool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.SiteProvisioner;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 슬롯 번호로 사용 가능한 사이트를 준비한다.
 *
 * - 사이트가 이미 있으면 정리(SiteCleaner) 후 재사용 (warm site)
 * - 없으면 새로 생성 (cold site, 생성 비용 전부 지불)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SiteFactory {

    private final SiteProvisioner siteProvisioner;
    private final SiteCleaner siteCleaner;
    private final SitePoolProperties sitePoolProperties;

    /**
     * 슬롯 사이트 이름 (prefix + 번호)
     */
    public String siteName(int slotIndex) {
        return sitePoolProperties.getPool().getSitePrefix() + slotIndex;
    }

    /**
     * 슬롯에 해당하는 사이트 준비
     *
     * @param slotIndex 슬롯 번호
     * @return slotIndex가 설정된 사이트
     */
    public Site prepare(int slotIndex) {
        String siteName = siteName(slotIndex);
        String operationName = "SiteFactory.prepare " + siteName;
        long startTime = System.currentTimeMillis();

        Optional<Site> existing = siteProvisioner.findSite(siteName);
        if (existing.isPresent()) {
            Site site = existing.get().toBuilder().slotIndex(slotIndex).build();
            log.info("{} Site already exists at {}. Reusing site", operationName, site.getPrimaryBinding());

            siteCleaner.clean(site);

            log.info("{} completed in {}ms", operationName, System.currentTimeMillis() - startTime);
            return site;
        }

        log.info("{} Creating new site", operationName);
        Site site = siteProvisioner.createSite(siteName).toBuilder().slotIndex(slotIndex).build();

        log.info("{} Created new site at {} in {}ms", operationName, site.getPrimaryBinding(),
                System.currentTimeMillis() - startTime);
        return site;
    }
}
