package org.brown.sitepool.site;

/**
 * 대기 시간 안에 반환된 슬롯이 없어 사이트를 할당할 수 없는 경우
 */
public class SitePoolExhaustedException extends SitePoolException {

    public SitePoolExhaustedException(String message) {
        super(message);
    }
}
