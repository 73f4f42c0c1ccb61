package org.brown.sitepool.vfs;

import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.site.GatewayUnavailableException;
import org.brown.sitepool.site.Site;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpWebRootWriterTest {

    private static final String MARKER_URL = "http://localhost:8001/api/vfs/site/wwwroot/hostingstart.html";

    private final Site site = Site.builder()
            .slotIndex(1)
            .name("sitepool-reused-1")
            .containerId("abc123")
            .primaryBinding("http://localhost:8001")
            .build();

    private MockRestServiceServer server;
    private HttpWebRootWriter writer;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        writer = new HttpWebRootWriter(restTemplate, new SitePoolProperties());
    }

    @Test
    void putsContentToVfsPath() {
        server.expect(requestTo(MARKER_URL))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(header("If-Match", "*"))
                .andExpect(content().string("<h1>ready</h1>"))
                .andRespond(withSuccess());

        writer.writeAllText(site, "hostingstart.html", "<h1>ready</h1>");

        server.verify();
    }

    @Test
    void badGatewayBecomesGatewayUnavailable() {
        server.expect(requestTo(MARKER_URL)).andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> writer.writeAllText(site, "hostingstart.html", "x"))
                .isInstanceOf(GatewayUnavailableException.class)
                .hasMessageContaining("hostingstart.html")
                .hasMessageContaining("502")
                .hasCauseInstanceOf(HttpServerErrorException.class);
    }

    @Test
    void serviceUnavailableBecomesGatewayUnavailable() {
        server.expect(requestTo(MARKER_URL)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> writer.writeAllText(site, "hostingstart.html", "x"))
                .isInstanceOf(GatewayUnavailableException.class)
                .hasMessageContaining("503");
    }

    @Test
    void otherServerErrorsPropagate() {
        server.expect(requestTo(MARKER_URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> writer.writeAllText(site, "hostingstart.html", "x"))
                .isInstanceOf(HttpServerErrorException.class)
                .isNotInstanceOf(GatewayUnavailableException.class);
    }
}
