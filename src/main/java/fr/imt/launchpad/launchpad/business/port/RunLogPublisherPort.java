package fr.imt.launchpad.launchpad.business.port;

public interface RunLogPublisherPort {
    void publish(String runId, String message);
}
