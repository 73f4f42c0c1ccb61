package org.brown.sitepool.vfs;

import lombok.RequiredArgsConstructor;
import org.brown.sitepool.config.SitePoolProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * 사이트 VFS(HTTP 파일 API) 클라이언트 설정
 */
@Configuration
@RequiredArgsConstructor
public class VfsConfig {

    private final SitePoolProperties sitePoolProperties;

    @Bean
    public RestTemplate vfsRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(sitePoolProperties.getVfs().getConnectTimeout())
                .setReadTimeout(sitePoolProperties.getVfs().getReadTimeout())
                .build();
    }
}
