package org.brown.sitepool.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PortBinding;
import com.github.dockerjava.api.model.Ports;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.brown.sitepool.site.Site;
import org.brown.sitepool.site.SiteOperationException;
import org.brown.sitepool.site.SiteProvisioner;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Docker 컨테이너 기반 사이트 프로비저너
 *
 * 사이트 하나 = 이름이 고정된 컨테이너 하나.
 * 컨테이너 포트를 임의의 호스트 포트로 publish 하고 그 주소를 기본 바인딩으로 사용한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DockerSiteProvisioner implements SiteProvisioner {

    static final String SITE_LABEL = "sitepool.site";

    private final DockerClient dockerClient;
    private final SitePoolProperties sitePoolProperties;

    @Override
    public Optional<Site> findSite(String name) {
        // name 필터는 부분 일치이므로 정확히 "/<name>" 인 컨테이너만 고른다
        List<Container> containers = dockerClient.listContainersCmd()
                .withShowAll(true)
                .withNameFilter(List.of(name))
                .exec();

        Optional<Container> match = containers.stream()
                .filter(c -> c.getNames() != null && Arrays.asList(c.getNames()).contains("/" + name))
                .findFirst();

        if (match.isEmpty()) {
            log.debug("No container found for site: {}", name);
            return Optional.empty();
        }

        String containerId = match.get().getId();
        if (!"running".equalsIgnoreCase(match.get().getState())) {
            log.info("Site container {} ({}) is {}, starting it", name, containerId, match.get().getState());
            startContainer(containerId);
        }

        return Optional.of(toSite(name, containerId));
    }

    @Override
    public Site createSite(String name) {
        String image = sitePoolProperties.getDocker().getImage();
        ExposedPort exposedPort = ExposedPort.tcp(sitePoolProperties.getDocker().getContainerPort());

        log.debug("Creating site container: {} with image: {}", name, image);

        try {
            // 호스트 포트는 Docker가 임의로 할당
            HostConfig hostConfig = HostConfig.newHostConfig()
                    .withPortBindings(new PortBinding(Ports.Binding.empty(), exposedPort));

            CreateContainerResponse container = dockerClient.createContainerCmd(image)
                    .withName(name)
                    .withLabels(Map.of(SITE_LABEL, name))
                    .withExposedPorts(exposedPort)
                    .withHostConfig(hostConfig)
                    .exec();

            String containerId = container.getId();
            startContainer(containerId);
            log.debug("Started site container: {} ({})", name, containerId);

            return toSite(name, containerId);

        } catch (DockerException e) {
            throw new SiteOperationException("Failed to create site " + name + " from image " + image, e);
        }
    }

    @Override
    public Duration getUptime(Site site) {
        try {
            InspectContainerResponse inspection = dockerClient.inspectContainerCmd(site.getContainerId()).exec();
            String startedAt = inspection.getState().getStartedAt();
            if (startedAt == null || startedAt.isEmpty()) {
                throw new SiteOperationException("Site " + site.getName() + " has no start time");
            }
            return Duration.between(Instant.parse(startedAt), Instant.now());

        } catch (DockerException e) {
            throw new SiteOperationException("Failed to inspect site " + site.getName(), e);
        }
    }

    private void startContainer(String containerId) {
        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (DockerException e) {
            throw new SiteOperationException("Failed to start container " + containerId, e);
        }
    }

    /**
     * 컨테이너 inspect 결과로 Site 생성 (publish 된 호스트 포트 확인)
     */
    private Site toSite(String name, String containerId) {
        ExposedPort exposedPort = ExposedPort.tcp(sitePoolProperties.getDocker().getContainerPort());
        InspectContainerResponse inspection = dockerClient.inspectContainerCmd(containerId).exec();

        String primaryBinding = null;
        if (inspection.getNetworkSettings() != null && inspection.getNetworkSettings().getPorts() != null) {
            Ports.Binding[] bindings = inspection.getNetworkSettings().getPorts().getBindings().get(exposedPort);
            if (bindings != null && bindings.length > 0) {
                primaryBinding = String.format("http://%s:%s",
                        sitePoolProperties.getDocker().getHost(), bindings[0].getHostPortSpec());
            }
        }

        if (primaryBinding == null) {
            throw new SiteOperationException("Site " + name + " has no published binding for " + exposedPort);
        }

        return Site.builder()
                .name(name)
                .containerId(containerId)
                .primaryBinding(primaryBinding)
                .build();
    }
}
