package org.brown.sitepool.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;

/**
 * AWS SDK 클라이언트 설정
 *
 * 풀 메트릭 전송용 CloudWatch 클라이언트만 사용한다.
 */
@Configuration
@RequiredArgsConstructor
public class AwsConfig {

    private final SitePoolProperties sitePoolProperties;

    @Bean
    public CloudWatchClient cloudWatchClient() {
        return CloudWatchClient.builder()
                .region(Region.of(sitePoolProperties.getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }
}
