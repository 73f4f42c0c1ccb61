package org.brown.sitepool.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.core.command.ExecStartResultCallback;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.sitepool.config.SitePoolProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 컨테이너 내부 명령 실행 (docker exec)
 *
 * 실행 자체가 실패해도 예외를 던지지 않고 exitCode -1 결과를 반환한다.
 * 결과 해석(무시할지, 실패로 볼지)은 호출자가 결정한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContainerExec {

    private final DockerClient dockerClient;
    private final SitePoolProperties sitePoolProperties;

    /**
     * 컨테이너 내부에서 명령 실행
     *
     * @param containerId 컨테이너 ID
     * @param cmd         실행할 명령
     * @return 실행 결과 (exitCode, stdout, stderr)
     */
    public ExecResult run(String containerId, List<String> cmd) {
        try {
            ExecCreateCmdResponse execCreateResponse = dockerClient.execCreateCmd(containerId)
                    .withCmd(cmd.toArray(new String[0]))
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec();

            String execId = execCreateResponse.getId();
            log.debug("Created exec: {} in container: {} cmd: {}", execId, containerId, cmd);

            StringBuilder stdoutBuilder = new StringBuilder();
            StringBuilder stderrBuilder = new StringBuilder();

            ExecStartResultCallback callback = new ExecStartResultCallback() {
                @Override
                public void onNext(Frame frame) {
                    String payload = new String(frame.getPayload(), StandardCharsets.UTF_8);

                    switch (frame.getStreamType()) {
                        case STDOUT, RAW -> stdoutBuilder.append(payload);
                        case STDERR -> stderrBuilder.append(payload);
                        default -> {
                        }
                    }
                }
            };

            ExecStartResultCallback running = dockerClient.execStartCmd(execId).exec(callback);

            boolean completed;
            try {
                completed = running.awaitCompletion(sitePoolProperties.getDocker().getExecTimeoutSeconds(),
                        TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                closeStream(execId, running);
                throw e;
            }

            if (!completed) {
                log.warn("Exec {} in container {} did not finish within {}s", execId, containerId,
                        sitePoolProperties.getDocker().getExecTimeoutSeconds());
                // attach 스트림이 Docker 클라이언트 연결을 계속 잡고 있지 않도록 닫는다
                closeStream(execId, running);
                return new ExecResult(-1, stdoutBuilder.toString(), "Execution timed out");
            }

            Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
            log.debug("Exec {} finished with exit code: {}", execId, exitCode);

            return new ExecResult(
                    exitCode != null ? exitCode.intValue() : -1,
                    stdoutBuilder.toString(),
                    stderrBuilder.toString()
            );

        } catch (InterruptedException e) {
            log.error("Exec execution interrupted in container: {}", containerId, e);
            Thread.currentThread().interrupt();
            return new ExecResult(-1, "", "Execution interrupted");
        } catch (Exception e) {
            log.error("Failed to execute in container: {}", containerId, e);
            return new ExecResult(-1, "", "Execution failed: " + e.getMessage());
        }
    }

    private void closeStream(String execId, ExecStartResultCallback callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.warn("Failed to close stream of exec {}", execId, e);
        }
    }

    /**
     * Exec 실행 결과
     */
    public record ExecResult(int exitCode, String stdout, String stderr) {

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
