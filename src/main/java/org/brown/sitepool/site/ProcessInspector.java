package org.brown.sitepool.site;

import java.util.List;

/**
 * 사이트 프로세스 조회/종료 백엔드 인터페이스
 */
public interface ProcessInspector {

    /**
     * 사이트에서 실행 중인 프로세스 목록과 각 프로세스의 열린 핸들을 반환한다.
     */
    List<SiteProcess> listProcesses(Site site);

    /**
     * 프로세스를 강제 종료한다.
     *
     * @param throwOnError true면 종료 실패 시 SiteOperationException을 던진다
     */
    void killProcess(Site site, int processId, boolean throwOnError);
}
