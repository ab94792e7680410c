package fr.imt.launchpad.launchpad.infrastructure.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.PushResponseItem;
import fr.imt.launchpad.launchpad.business.port.RegistrySession;
import fr.imt.launchpad.launchpad.exception.DockerOperationException;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds registry credentials for a series of pushes. The daemon keeps no login state between
 * commands, so closing the session just drops the credentials.
 */
@Slf4j
class DockerRegistrySession implements RegistrySession {

    private final DockerClient dockerClient;
    private final int timeoutSeconds;
    private AuthConfig authConfig;

    DockerRegistrySession(DockerClient dockerClient, AuthConfig authConfig, int timeoutSeconds) {
        this.dockerClient = dockerClient;
        this.authConfig = authConfig;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public void push(String imageName, String tag) {
        if (authConfig == null) {
            throw new IllegalStateException("Registry session is closed");
        }

        AtomicReference<String> pushError = new AtomicReference<>();
        try {
            boolean completed = dockerClient.pushImageCmd(imageName)
                    .withTag(tag)
                    .withAuthConfig(authConfig)
                    .exec(new ResultCallback.Adapter<PushResponseItem>() {
                        @Override
                        public void onNext(PushResponseItem item) {
                            if (item.isErrorIndicated()) {
                                pushError.compareAndSet(null, item.getErrorDetail() != null
                                        ? item.getErrorDetail().getMessage()
                                        : item.getError());
                            }
                        }
                    })
                    .awaitCompletion(timeoutSeconds, TimeUnit.SECONDS);

            if (!completed) {
                throw new DockerOperationException("Push of " + imageName + ":" + tag
                        + " did not finish within " + timeoutSeconds + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DockerOperationException("push " + imageName + ":" + tag, e);
        } catch (DockerException e) {
            throw new DockerOperationException("push " + imageName + ":" + tag, e);
        }

        if (pushError.get() != null) {
            throw new DockerOperationException("Registry rejected " + imageName + ":" + tag + ": " + pushError.get());
        }
        log.debug("Pushed {}:{}", imageName, tag);
    }

    @Override
    public void close() {
        authConfig = null;
    }
}
