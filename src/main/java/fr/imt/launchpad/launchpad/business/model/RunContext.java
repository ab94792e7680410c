package fr.imt.launchpad.launchpad.business.model;

import fr.imt.launchpad.launchpad.business.utils.SecretRedactor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Mutable state of a single pipeline run. Stages run one at a time, so the only concurrent reader is the
 * status API; the collections are copy-on-write for that reason.
 */
@Getter
public class RunContext {

    private final String runId;
    private final String projectName;
    private final String branch;
    private final String revision;
    private final String buildUrl;
    private final Instant startedAt;
    private final Map<String, String> environment;
    private final ImageReference plannedImage;

    @Getter(lombok.AccessLevel.NONE)
    private final SecretRedactor redactor = new SecretRedactor();
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, Credential> credentials = new ConcurrentHashMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final List<StageOutcome> outcomes = new CopyOnWriteArrayList<>();
    @Getter(lombok.AccessLevel.NONE)
    private final List<RunWarning> warnings = new CopyOnWriteArrayList<>();

    private volatile ImageReference builtImage;
    private volatile DeploymentTarget deployment;
    private volatile String currentStage;
    private volatile boolean cancelled;

    @Builder
    private RunContext(String runId, String projectName, String branch, String revision, String buildUrl,
                       Instant startedAt, Map<String, String> environment, ImageReference plannedImage) {
        this.runId = runId;
        this.projectName = projectName;
        this.branch = branch;
        this.revision = revision;
        this.buildUrl = buildUrl;
        this.startedAt = startedAt != null ? startedAt : Instant.now();
        this.environment = environment != null ? Map.copyOf(environment) : Map.of();
        this.plannedImage = plannedImage;
    }

    /**
     * Keep a resolved credential for the rest of the run and mask its secret values.
     * Outcomes and warnings recorded before are masked again; lines already published are not.
     */
    public synchronized void registerCredential(Credential credential) {
        credential.secretValues().forEach(redactor::register);
        credentials.put(credential.id(), credential);
        outcomes.replaceAll(outcome -> outcome.redacted(redactor::redact));
        warnings.replaceAll(warning -> new RunWarning(warning.code(), redactor.redact(warning.message())));
    }

    public Optional<Credential> credential(String id) {
        return Optional.ofNullable(credentials.get(id));
    }

    public String redact(String text) {
        return redactor.redact(text);
    }

    public boolean containsSecret(String text) {
        return text != null && !text.equals(redactor.redact(text));
    }

    public synchronized void recordOutcome(StageOutcome outcome) {
        outcomes.add(outcome.redacted(redactor::redact));
    }

    public List<StageOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public synchronized void addWarning(String code, String message) {
        warnings.add(new RunWarning(code, redact(message)));
    }

    public List<RunWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void setBuiltImage(ImageReference builtImage) {
        this.builtImage = builtImage;
    }

    public void setDeployment(DeploymentTarget deployment) {
        this.deployment = deployment;
    }

    public void setCurrentStage(String currentStage) {
        this.currentStage = currentStage;
    }

    /**
     * Image the run is working with: the built one once it exists, the planned one before.
     */
    public ImageReference currentImage() {
        return builtImage != null ? builtImage : plannedImage;
    }

    public void cancel() {
        this.cancelled = true;
    }
}
