package org.brown.sitepool.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 사이트 풀 백그라운드 작업 설정
 */
@Configuration
public class PoolConfig {

    /**
     * 다음 사이트를 미리 준비하는 전용 스레드
     *
     * 종료 시 shutdownNow 로 진행 중인 준비 작업을 인터럽트한다.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService sitePrefetchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "site-prefetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * CloudWatch 전송 전용 스레드 (acquire() 호출 스레드가 네트워크 왕복을 기다리지 않도록)
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService metricsPublishExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pool-metrics-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
