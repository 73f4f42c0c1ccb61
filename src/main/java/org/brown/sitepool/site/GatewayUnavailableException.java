package org.brown.sitepool.site;

/**
 * 사이트 프런트엔드가 502/503을 반환한 경우 (콜드 스타트 중인 사이트)
 */
public class GatewayUnavailableException extends SitePoolException {

    public GatewayUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
