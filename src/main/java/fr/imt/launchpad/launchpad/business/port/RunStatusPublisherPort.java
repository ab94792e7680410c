package fr.imt.launchpad.launchpad.business.port;

public interface RunStatusPublisherPort {
    void publish(String runId, String status, String currentStage);
}
