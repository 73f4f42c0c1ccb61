package org.brown.sitepool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * SitePool - 테스트 사이트 풀 서비스
 *
 * 배포 비용이 큰 웹 애플리케이션 인스턴스(사이트)를 고정된 슬롯 단위로 재사용하여
 * 동시에 실행되는 테스트에 빠르게 나누어 준다.
 *
 * 주요 기능:
 * - 슬롯 레지스트리 기반 사이트 할당 (한 슬롯은 동시에 한 테스트만 사용)
 * - 다음 사이트를 백그라운드에서 미리 준비 (Prefetch)
 * - 재사용 사이트 정리 (stale 워커 프로세스 종료, 저장소 삭제, 기본 파일 재작성)
 * - 테스트 결과에 따른 슬롯 반환/폐기
 *
 * @author SitePool Team
 * @version 0.1
 */
@SpringBootApplication
public class SitePoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(SitePoolApplication.class, args);
    }

}
