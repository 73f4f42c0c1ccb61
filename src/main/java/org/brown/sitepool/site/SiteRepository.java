package org.brown.sitepool.site;

/**
 * 사이트 소스 저장소 백엔드 인터페이스
 */
public interface SiteRepository {

    /**
     * 사이트의 저장소 작업 트리를 삭제한다.
     *
     * @param deleteWebRoot true면 웹 루트 내용도 함께 삭제
     * @param ignoreErrors  true면 삭제 실패를 무시
     */
    void delete(Site site, boolean deleteWebRoot, boolean ignoreErrors);
}
