package org.brown.sitepool.vfs;

import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.site.GatewayUnavailableException;
import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.WebRootWriter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;

/**
 * 사이트 VFS API로 웹 루트에 파일을 쓴다.
 *
 * PUT {binding}{pathPrefix}{path}
 * 502/503 응답은 사이트가 아직 기동 중이라는 뜻이므로 GatewayUnavailableException으로 구분한다.
 */
@Slf4j
@Service
public class HttpWebRootWriter implements WebRootWriter {

    private final RestTemplate restTemplate;
    private final SitePoolProperties sitePoolProperties;

    public HttpWebRootWriter(@Qualifier("vfsRestTemplate") RestTemplate restTemplate,
                             SitePoolProperties sitePoolProperties) {
        this.restTemplate = restTemplate;
        this.sitePoolProperties = sitePoolProperties;
    }

    @Override
    public void writeAllText(Site site, String path, String content) {
        String url = site.getPrimaryBinding() + sitePoolProperties.getVfs().getPathPrefix() + path;

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8));
        headers.setIfMatch("*");  // 기존 파일 덮어쓰기

        log.debug("Writing {} ({} chars) to site {}", path, content.length(), site.getName());

        try {
            restTemplate.exchange(url, HttpMethod.PUT, new HttpEntity<>(content, headers), Void.class);
            log.debug("Wrote {} to site {}", path, site.getName());

        } catch (HttpServerErrorException e) {
            if (isGatewayUnavailable(e)) {
                throw new GatewayUnavailableException(
                        String.format("Writing %s to %s failed: %s", path, site.getName(), e.getMessage()), e);
            }
            throw e;
        }
    }

    private boolean isGatewayUnavailable(HttpServerErrorException e) {
        int status = e.getStatusCode().value();
        return status == HttpStatus.BAD_GATEWAY.value() || status == HttpStatus.SERVICE_UNAVAILABLE.value();
    }
}
