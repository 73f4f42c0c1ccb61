package org.brown.sitepool.site;

import java.util.List;

/**
 * 사이트 안에서 실행 중인 프로세스 정보
 *
 * @param id          프로세스 ID
 * @param name        프로세스 이름
 * @param openHandles 열려 있는 파일 핸들 / 로드된 모듈 경로
 */
public record SiteProcess(int id, String name, List<String> openHandles) {

    public SiteProcess {
        openHandles = openHandles == null ? List.of() : List.copyOf(openHandles);
    }
}
