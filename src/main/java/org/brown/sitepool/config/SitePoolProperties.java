package org.brown.sitepool.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * SitePool 통합 설정 프로퍼티
 *
 * application.yml의 sitepool.* 설정을 바인딩
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "sitepool")
public class SitePoolProperties {

    private PoolConfig pool = new PoolConfig();
    private DockerConfig docker = new DockerConfig();
    private CleanupConfig cleanup = new CleanupConfig();
    private VfsConfig vfs = new VfsConfig();
    private AwsConfig aws = new AwsConfig();
    private MetricsConfig metrics = new MetricsConfig();

    @Data
    public static class PoolConfig {
        private int size = 5;
        private String sitePrefix = "sitepool-reused-";
        private Duration slotWaitTimeout = Duration.ofMinutes(5);     // 슬롯이 모두 사용 중일 때 대기 한도
        private Duration pendingWaitTimeout = Duration.ofMinutes(5);  // 진행 중인 prefetch 대기 한도
        private boolean prefetchOnStartup = false;
    }

    @Data
    public static class DockerConfig {
        private String image = "sitepool/webapp:latest";
        private String host = "localhost";
        private int containerPort = 80;
        private String repositoryPath = "/home/site/repository";
        private String webRootPath = "/home/site/wwwroot";
        private long execTimeoutSeconds = 60;
    }

    @Data
    public static class CleanupConfig {
        private String workerProcessName = "w3wp";
        private String staleModule = "kre.host.dll";
        private String markerFile = "hostingstart.html";
        private String markerContent = "<h1>This web site has been successfully created</h1>";
    }

    @Data
    public static class VfsConfig {
        private String pathPrefix = "/api/vfs/site/wwwroot/";
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class AwsConfig {
        private String region = "ap-northeast-2";
    }

    @Data
    public static class MetricsConfig {
        private boolean enabled = false;
        private String namespace = "SitePool/TestHarness";
    }

    // Convenience methods
    public String getRegion() {
        return aws.getRegion();
    }
}
