package org.brown.sitepool.docker;

import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.SiteOperationException;
import org.brown.sitepool.site.SiteProcess;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DockerProcessInspectorTest {

    private final Site site = Site.builder()
            .slotIndex(1)
            .name("sitepool-reused-1")
            .containerId("abc123")
            .primaryBinding("http://localhost:49153")
            .build();

    private ContainerExec containerExec;
    private DockerProcessInspector inspector;

    @BeforeEach
    void setUp() {
        containerExec = mock(ContainerExec.class);
        inspector = new DockerProcessInspector(containerExec);
    }

    @Test
    void parsesProcessesWithTheirHandles() {
        String output = "#1 sh\n"
                + "/dev/null\n"
                + "#42 w3wp\n"
                + "/usr/lib/runtime/kre.host.dll\n"
                + "socket:[12345]\n"
                + "/usr/lib/runtime/kre.host.dll\n"
                + "\n"
                + "#77 node\n";

        List<SiteProcess> processes = DockerProcessInspector.parseProcessListing(output);

        assertThat(processes).extracting(SiteProcess::id).containsExactly(1, 42, 77);
        assertThat(processes.get(1).name()).isEqualTo("w3wp");
        assertThat(processes.get(1).openHandles())
                .containsExactly("/usr/lib/runtime/kre.host.dll", "socket:[12345]");
        assertThat(processes.get(2).openHandles()).isEmpty();
    }

    @Test
    void skipsMalformedHeadersAndTheirHandles() {
        String output = "#self bash\n/etc/passwd\n#9 w3wp\n/tmp/x\n";

        List<SiteProcess> processes = DockerProcessInspector.parseProcessListing(output);

        assertThat(processes).containsExactly(new SiteProcess(9, "w3wp", List.of("/tmp/x")));
    }

    @Test
    void emptyOutputMeansNoProcesses() {
        assertThat(DockerProcessInspector.parseProcessListing("")).isEmpty();
        assertThat(DockerProcessInspector.parseProcessListing(null)).isEmpty();
    }

    @Test
    void listProcessesRunsScriptInSiteContainer() {
        when(containerExec.run(eq("abc123"), anyList()))
                .thenReturn(new ContainerExec.ExecResult(0, "#5 w3wp\n/a.dll\n", ""));

        List<SiteProcess> processes = inspector.listProcesses(site);

        assertThat(processes).containsExactly(new SiteProcess(5, "w3wp", List.of("/a.dll")));
    }

    @Test
    void listProcessesFailsOnNonZeroExit() {
        when(containerExec.run(eq("abc123"), anyList()))
                .thenReturn(new ContainerExec.ExecResult(-1, "", "Execution failed: container not running"));

        assertThatThrownBy(() -> inspector.listProcesses(site))
                .isInstanceOf(SiteOperationException.class)
                .hasMessageContaining("sitepool-reused-1")
                .hasMessageContaining("container not running");
    }

    @Test
    void killSendsSigkill() {
        when(containerExec.run("abc123", List.of("kill", "-9", "42")))
                .thenReturn(new ContainerExec.ExecResult(0, "", ""));

        inspector.killProcess(site, 42, true);

        verify(containerExec).run("abc123", List.of("kill", "-9", "42"));
    }

    @Test
    void killFailureIsOnlyLoggedWhenNotThrowing() {
        when(containerExec.run("abc123", List.of("kill", "-9", "42")))
                .thenReturn(new ContainerExec.ExecResult(1, "", "No such process\n"));

        inspector.killProcess(site, 42, false);

        assertThatThrownBy(() -> inspector.killProcess(site, 42, true))
                .isInstanceOf(SiteOperationException.class)
                .hasMessageContaining("No such process");
    }
}
