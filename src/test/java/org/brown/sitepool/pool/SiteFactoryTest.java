package org.brown.sitepool.pool;

import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.site.GatewayUnavailableException;
import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.SiteOperationException;
import org.brown.sitepool.site.SiteProvisioner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SiteFactoryTest {

    private SiteProvisioner siteProvisioner;
    private SiteCleaner siteCleaner;
    private SiteFactory siteFactory;

    @BeforeEach
    void setUp() {
        siteProvisioner = mock(SiteProvisioner.class);
        siteCleaner = mock(SiteCleaner.class);

        SitePoolProperties properties = new SitePoolProperties();
        properties.getPool().setSitePrefix("kudu-reused-");
        siteFactory = new SiteFactory(siteProvisioner, siteCleaner, properties);
    }

    @Test
    void siteNameIsPrefixPlusSlotIndex() {
        assertThat(siteFactory.siteName(4)).isEqualTo("kudu-reused-4");
    }

    @Test
    void missingSiteIsCreatedWithoutCleanup() {
        when(siteProvisioner.findSite("kudu-reused-3")).thenReturn(Optional.empty());
        when(siteProvisioner.createSite("kudu-reused-3")).thenReturn(unindexed("kudu-reused-3"));

        Site site = siteFactory.prepare(3);

        assertThat(site.getSlotIndex()).isEqualTo(3);
        assertThat(site.getName()).isEqualTo("kudu-reused-3");
        assertThat(site.getPrimaryBinding()).isEqualTo("http://localhost:9000");
        verify(siteCleaner, never()).clean(any());
    }

    @Test
    void existingSiteIsCleanedAndReused() {
        when(siteProvisioner.findSite("kudu-reused-2")).thenReturn(Optional.of(unindexed("kudu-reused-2")));

        Site site = siteFactory.prepare(2);

        ArgumentCaptor<Site> cleaned = ArgumentCaptor.forClass(Site.class);
        verify(siteCleaner).clean(cleaned.capture());
        assertThat(cleaned.getValue().getSlotIndex()).isEqualTo(2);
        assertThat(site).isEqualTo(cleaned.getValue());
        verify(siteProvisioner, never()).createSite(anyString());
    }

    @Test
    void cleanupFailureFailsPreparation() {
        when(siteProvisioner.findSite("kudu-reused-1")).thenReturn(Optional.of(unindexed("kudu-reused-1")));
        GatewayUnavailableException failure = new GatewayUnavailableException("502 Bad Gateway", null);
        doThrow(failure).when(siteCleaner).clean(any());

        assertThatThrownBy(() -> siteFactory.prepare(1)).isSameAs(failure);
    }

    @Test
    void createFailurePropagates() {
        when(siteProvisioner.findSite("kudu-reused-5")).thenReturn(Optional.empty());
        when(siteProvisioner.createSite("kudu-reused-5")).thenThrow(new SiteOperationException("no such image"));

        assertThatThrownBy(() -> siteFactory.prepare(5))
                .isInstanceOf(SiteOperationException.class)
                .hasMessage("no such image");
    }

    private static Site unindexed(String name) {
        return Site.builder()
                .name(name)
                .containerId("container-" + name)
                .primaryBinding("http://localhost:9000")
                .build();
    }
}
