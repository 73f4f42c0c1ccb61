package org.brown.sitepool.pool;

/**
 * 사이트가 어떤 경로로 할당되었는지
 */
public enum AllocationPath {
    /**
     * 미리 준비된(prefetch) 사이트를 바로 받음
     */
    WARM,
    /**
     * 요청 스레드에서 직접 사이트를 준비함
     */
    COLD
}
