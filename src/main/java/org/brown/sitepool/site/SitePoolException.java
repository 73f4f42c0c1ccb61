package org.brown.sitepool.site;

/**
 * SitePool 공통 런타임 예외
 */
public class SitePoolException extends RuntimeException {

    public SitePoolException(String message) {
        super(message);
    }

    public SitePoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
