package org.brown.sitepool.harness;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.pool.SitePool;
import org.brown.sitepool.site.Site;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * 테스트 하네스 진입점
 *
 * 사이트 할당 → 테스트 실행 → 결과 보고를 한 번에 처리한다.
 * 테스트가 예외 없이 끝나면 성공, 예외를 던지면 실패로 보고하고 예외는 그대로 다시 던진다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SiteTestRunner {

    private final SitePool sitePool;

    /**
     * 사이트를 할당받아 테스트 실행
     *
     * @param testName 테스트 이름 (로그 MDC용)
     * @param test     테스트 본문
     * @return 테스트 반환값
     * @throws Exception 테스트가 던진 예외, 또는 사이트 할당 실패
     */
    public <T> T run(String testName, SiteTest<T> test) throws Exception {
        MDC.put("testName", testName);
        try {
            Site site = sitePool.acquire();
            MDC.put("siteName", site.getName());

            boolean success = false;
            long startTime = System.currentTimeMillis();
            try {
                log.info("===== Test started on {} =====", site);
                T result = test.run(site);
                success = true;
                return result;
            } finally {
                long durationMillis = System.currentTimeMillis() - startTime;
                if (success) {
                    log.info("[DONE][OK] {} finished in {}ms", testName, durationMillis);
                } else {
                    log.error("[DONE][FAIL] {} failed after {}ms on {}", testName, durationMillis, site.getName());
                }
                sitePool.report(site, success);
            }
        } finally {
            MDC.remove("siteName");
            MDC.remove("testName");
        }
    }
}
