package org.brown.sitepool.docker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.SiteOperationException;
import org.brown.sitepool.site.SiteRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 사이트 컨테이너 내부의 저장소 작업 트리 삭제
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DockerSiteRepository implements SiteRepository {

    private final ContainerExec containerExec;
    private final SitePoolProperties sitePoolProperties;

    @Override
    public void delete(Site site, boolean deleteWebRoot, boolean ignoreErrors) {
        String repositoryPath = sitePoolProperties.getDocker().getRepositoryPath();
        String webRootPath = sitePoolProperties.getDocker().getWebRootPath();

        // 웹 루트는 지운 뒤 빈 디렉터리로 다시 만든다 (이후 기본 파일 쓰기용)
        String script = deleteWebRoot
                ? String.format("rm -rf '%s' '%s' && mkdir -p '%s'", repositoryPath, webRootPath, webRootPath)
                : String.format("rm -rf '%s'", repositoryPath);

        log.debug("Deleting repository of site {} (deleteWebRoot={})", site.getName(), deleteWebRoot);
        ContainerExec.ExecResult result = containerExec.run(site.getContainerId(), List.of("sh", "-c", script));

        if (result.isSuccess()) {
            log.info("Deleted repository of site {}", site.getName());
            return;
        }

        String message = String.format("Failed to delete repository of site %s (exitCode=%d): %s",
                site.getName(), result.exitCode(), result.stderr().trim());
        if (!ignoreErrors) {
            throw new SiteOperationException(message);
        }
        log.warn("{} (ignored)", message);
    }
}
