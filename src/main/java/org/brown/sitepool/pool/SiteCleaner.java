package org.brown.sitepool.pool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.site.GatewayUnavailableException;
import org.brown.sitepool.site.ProcessInspector;
import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.SiteProcess;
import org.brown.sitepool.site.SiteProvisioner;
import org.brown.sitepool.site.SiteRepository;
import org.brown.sitepool.site.WebRootWriter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * 재사용 사이트 정리 파이프라인
 *
 * 이전 테스트가 남긴 상태를 지우고 항상 같은 시작 상태로 만든다.
 * 1. stale 모듈을 붙잡고 있는 워커 프로세스 종료 (best-effort)
 * 2. 저장소 작업 트리 + 웹 루트 삭제 (best-effort)
 * 3. 기본 파일(marker) 재작성 - 실패하면 사이트 준비 실패로 간주
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SiteCleaner {

    private final ProcessInspector processInspector;
    private final SiteRepository siteRepository;
    private final WebRootWriter webRootWriter;
    private final SiteProvisioner siteProvisioner;
    private final SitePoolProperties sitePoolProperties;

    public void clean(Site site) {
        killStaleWorkers(site);
        deleteRepository(site);
        writeMarkerFile(site);
    }

    /**
     * 워커 프로세스 중 stale 모듈 핸들을 가진 프로세스 강제 종료
     */
    void killStaleWorkers(Site site) {
        String workerName = sitePoolProperties.getCleanup().getWorkerProcessName();
        String staleModule = sitePoolProperties.getCleanup().getStaleModule().toLowerCase(Locale.ROOT);

        List<SiteProcess> processes;
        try {
            processes = processInspector.listProcesses(site);
        } catch (Exception e) {
            log.warn("[CLEANUP] Could not list processes of site {}, skipping worker cleanup", site.getName(), e);
            return;
        }

        for (SiteProcess process : processes) {
            if (!workerName.equalsIgnoreCase(process.name())) continue;

            boolean holdsStaleModule = process.openHandles().stream()
                    .anyMatch(handle -> handle.toLowerCase(Locale.ROOT).contains(staleModule));
            if (!holdsStaleModule) continue;

            log.info("[CLEANUP] Killing stale worker {} ({}) in site {}", process.id(), process.name(), site.getName());
            try {
                processInspector.killProcess(site, process.id(), false);
            } catch (Exception e) {
                log.warn("[CLEANUP] Failed to kill worker {} in site {}", process.id(), site.getName(), e);
            }
        }
    }

    void deleteRepository(Site site) {
        try {
            siteRepository.delete(site, true, true);
        } catch (Exception e) {
            log.warn("[CLEANUP] Failed to delete repository of site {}, continuing", site.getName(), e);
        }
    }

    /**
     * 기본 파일 쓰기
     *
     * 502/503 으로 실패하면 사이트 가동 시간을 예외 메시지에 붙여서 다시 던진다.
     * 가동 시간을 얻지 못하면 원래 예외를 그대로 던진다.
     */
    void writeMarkerFile(Site site) {
        SitePoolProperties.CleanupConfig cleanup = sitePoolProperties.getCleanup();
        try {
            webRootWriter.writeAllText(site, cleanup.getMarkerFile(), cleanup.getMarkerContent());
        } catch (GatewayUnavailableException e) {
            Duration upTime = null;
            try {
                upTime = siteProvisioner.getUptime(site);
            } catch (Exception uptimeEx) {
                log.warn("[CLEANUP] Getting up time of site {} failed", site.getName(), uptimeEx);
            }

            if (upTime != null) {
                throw new GatewayUnavailableException(e.getMessage() + " Site up time: " + upTime, e);
            }
            throw e;
        }
    }
}
