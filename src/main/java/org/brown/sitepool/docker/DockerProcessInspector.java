package org.brown.sitepool.docker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.site.ProcessInspector;
import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.SiteOperationException;
import org.brown.sitepool.site.SiteProcess;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * /proc 를 읽어 사이트 컨테이너의 프로세스와 열린 핸들을 조회한다.
 *
 * 출력 형식 (프로세스마다):
 * <pre>
 * #&lt;pid&gt; &lt;comm&gt;
 * &lt;fd 대상 경로 또는 매핑된 모듈 경로&gt;
 * ...
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DockerProcessInspector implements ProcessInspector {

    private static final String LIST_PROCESSES_SCRIPT =
            "for p in /proc/[0-9]*; do "
                    + "pid=${p#/proc/}; "
                    + "echo \"#$pid $(cat $p/comm 2>/dev/null)\"; "
                    + "ls -l $p/fd 2>/dev/null | sed -n 's/.* -> //p'; "
                    + "awk '$6 ~ /^\\// {print $6}' $p/maps 2>/dev/null | sort -u; "
                    + "done";

    private final ContainerExec containerExec;

    @Override
    public List<SiteProcess> listProcesses(Site site) {
        ContainerExec.ExecResult result = containerExec.run(site.getContainerId(),
                List.of("sh", "-c", LIST_PROCESSES_SCRIPT));

        if (!result.isSuccess()) {
            throw new SiteOperationException(String.format(
                    "Failed to list processes of site %s (exitCode=%d): %s",
                    site.getName(), result.exitCode(), result.stderr()));
        }

        List<SiteProcess> processes = parseProcessListing(result.stdout());
        log.debug("Site {} has {} process(es)", site.getName(), processes.size());
        return processes;
    }

    @Override
    public void killProcess(Site site, int processId, boolean throwOnError) {
        ContainerExec.ExecResult result = containerExec.run(site.getContainerId(),
                List.of("kill", "-9", String.valueOf(processId)));

        if (result.isSuccess()) {
            log.info("Killed process {} in site {}", processId, site.getName());
            return;
        }

        String message = String.format("Failed to kill process %d in site %s (exitCode=%d): %s",
                processId, site.getName(), result.exitCode(), result.stderr().trim());
        if (throwOnError) {
            throw new SiteOperationException(message);
        }
        log.warn(message);
    }

    /**
     * 프로세스 목록 스크립트 출력 파싱
     */
    static List<SiteProcess> parseProcessListing(String output) {
        List<SiteProcess> processes = new ArrayList<>();
        if (output == null || output.isBlank()) {
            return processes;
        }

        Integer currentId = null;
        String currentName = null;
        Set<String> currentHandles = new LinkedHashSet<>();

        for (String rawLine : output.split("\n")) {
            String line = rawLine.trim();
            if (line.isEmpty()) continue;

            if (line.startsWith("#")) {
                if (currentId != null) {
                    processes.add(new SiteProcess(currentId, currentName, new ArrayList<>(currentHandles)));
                }
                String header = line.substring(1);
                int space = header.indexOf(' ');
                String pid = space < 0 ? header : header.substring(0, space);
                try {
                    currentId = Integer.parseInt(pid);
                } catch (NumberFormatException e) {
                    log.debug("Skipping malformed process header: {}", line);
                    currentId = null;
                }
                currentName = space < 0 ? "" : header.substring(space + 1).trim();
                currentHandles = new LinkedHashSet<>();
            } else if (currentId != null) {
                currentHandles.add(line);
            }
        }

        if (currentId != null) {
            processes.add(new SiteProcess(currentId, currentName, new ArrayList<>(currentHandles)));
        }
        return processes;
    }
}
