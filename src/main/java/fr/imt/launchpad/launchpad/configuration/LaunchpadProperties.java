package fr.imt.launchpad.launchpad.configuration;

import fr.imt.launchpad.launchpad.business.model.StageType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "launchpad")
public class LaunchpadProperties {

    private String projectName = "telco-churn";

    /**
     * Link to the run in the external scheduler; {runId} is substituted.
     */
    private String buildUrlTemplate;

    private String registryCredential = "docker-hub-credentials";

    private Map<String, CredentialProperties> credentials = new LinkedHashMap<>();

    private PipelineDefinition pipeline = new PipelineDefinition();

    private Runner runner = new Runner();

    private Image image = new Image();

    private Deployment deployment = new Deployment();

    private Health health = new Health();

    private Notification notification = new Notification();

    private Cleanup cleanup = new Cleanup();

    private History history = new History();

    private Toggle redis = new Toggle();

    private Toggle cli = new Toggle();

    @Data
    public static class CredentialProperties {
        private String username;
        private String password;
    }

    @Data
    public static class PipelineDefinition {
        private String name = "build-test-publish-deploy";
        private List<StageDefinition> stages = new ArrayList<>();
    }

    @Data
    public static class StageDefinition {
        private String name;
        private StageType type;
        private List<String> command = new ArrayList<>();
        private Duration timeout;
    }

    @Data
    public static class Runner {
        private Duration cancellationCheckInterval = Duration.ofMillis(200);
        private Duration abortGracePeriod = Duration.ofSeconds(10);
    }

    @Data
    public static class Image {
        private String registry = "docker.io";
        private String repository = "launchpad/telco-churn";
        private String buildContext = ".";
        private String dockerfile = "Dockerfile";
        private String floatingTag = "latest";
    }

    @Data
    public static class Deployment {
        private String name = "telco-churn-staging";
        private String host = "localhost";
        private int hostPort = 5000;
        private int containerPort = 5000;
        private Duration settleInterval = Duration.ofSeconds(10);
        private Map<String, String> env = new LinkedHashMap<>();
    }

    @Data
    public static class Health {
        private String path = "/health";
        private Duration budget = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofSeconds(2);
        private int testPort = 5001;
        private Duration probeTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Notification {
        private boolean enabled = true;
        private String from = "launchpad@localhost";
        private List<String> recipients = new ArrayList<>();
    }

    @Data
    public static class Cleanup {
        private boolean pruneImages = true;
    }

    @Data
    public static class History {
        private int maxRuns = 50;
    }

    /**
     * Switches read by conditional beans; bound here so they show up with the rest of the settings.
     */
    @Data
    public static class Toggle {
        private boolean enabled;
    }
}
