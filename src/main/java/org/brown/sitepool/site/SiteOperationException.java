package org.brown.sitepool.site;

/**
 * 백엔드 작업(컨테이너 exec, Docker API 호출 등) 실패
 */
public class SiteOperationException extends SitePoolException {

    public SiteOperationException(String message) {
        super(message);
    }

    public SiteOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
