package org.brown.sitepool.site;

/**
 * 사이트 웹 루트 파일 쓰기 백엔드 인터페이스
 */
public interface WebRootWriter {

    /**
     * 웹 루트 기준 상대 경로에 텍스트 파일을 쓴다.
     *
     * @throws GatewayUnavailableException 사이트 프런트엔드가 아직 준비되지 않은 경우 (502/503)
     */
    void writeAllText(Site site, String path, String content);
}
