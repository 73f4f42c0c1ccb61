package org.brown.sitepool.metrics;

import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.pool.AllocationPath;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * CloudWatch 커스텀 메트릭 퍼블리셔
 *
 * 사이트 할당 지연 시간(WARM/COLD)과 슬롯 폐기를 전송한다.
 * sitepool.metrics.enabled=false 이면 아무것도 보내지 않는다.
 * 전송은 별도 스레드(metricsPublishExecutor)에서 실행되고 호출자는 결과를 기다리지 않는다.
 */
@Slf4j
@Service
public class PoolMetricsPublisher {

    static final String METRIC_NAME_ACQUIRE_LATENCY = "AcquireLatencyMillis";
    static final String METRIC_NAME_SLOT_DISCARDED = "SlotDiscarded";

    private final CloudWatchClient cloudWatchClient;
    private final SitePoolProperties sitePoolProperties;
    private final Executor publishExecutor;

    public PoolMetricsPublisher(CloudWatchClient cloudWatchClient,
                                SitePoolProperties sitePoolProperties,
                                @Qualifier("metricsPublishExecutor") Executor publishExecutor) {
        this.cloudWatchClient = cloudWatchClient;
        this.sitePoolProperties = sitePoolProperties;
        this.publishExecutor = publishExecutor;
    }

    /**
     * 사이트 할당 지연 시간 전송
     *
     * @param path          할당 경로 (WARM, COLD)
     * @param latencyMillis acquire() 소요 시간 (밀리초)
     */
    public void publishAcquireLatency(AllocationPath path, long latencyMillis) {
        MetricDatum datum = MetricDatum.builder()
                .metricName(METRIC_NAME_ACQUIRE_LATENCY)
                .unit(StandardUnit.MILLISECONDS)
                .value((double) latencyMillis)
                .timestamp(Instant.now())
                .dimensions(dimension("AllocationPath", path.name()))
                .build();

        publish(datum);
    }

    /**
     * 슬롯 폐기 1건 전송
     */
    public void publishSlotDiscarded(int slotIndex) {
        MetricDatum datum = MetricDatum.builder()
                .metricName(METRIC_NAME_SLOT_DISCARDED)
                .unit(StandardUnit.COUNT)
                .value(1.0)
                .timestamp(Instant.now())
                .dimensions(dimension("SlotIndex", String.valueOf(slotIndex)))
                .build();

        publish(datum);
    }

    private void publish(MetricDatum datum) {
        if (!sitePoolProperties.getMetrics().isEnabled()) {
            log.debug("Metrics disabled, skipping CloudWatch publish of {}", datum.metricName());
            return;
        }

        PutMetricDataRequest request = PutMetricDataRequest.builder()
                .namespace(sitePoolProperties.getMetrics().getNamespace())
                .metricData(datum)
                .build();

        try {
            publishExecutor.execute(() -> send(request, datum));
        } catch (RejectedExecutionException e) {
            log.warn("Metric {} dropped, publisher is shutting down", datum.metricName());
        }
    }

    private void send(PutMetricDataRequest request, MetricDatum datum) {
        try {
            cloudWatchClient.putMetricData(request);
            log.debug("Published {}={} to CloudWatch", datum.metricName(), datum.value());

        } catch (Exception e) {
            // 메트릭 전송 실패가 사이트 할당에 영향을 주지 않도록 예외를 삼킨다
            log.warn("Failed to publish metric {} to CloudWatch", datum.metricName(), e);
        }
    }

    private Dimension dimension(String name, String value) {
        return Dimension.builder()
                .name(name)
                .value(value)
                .build();
    }
}
