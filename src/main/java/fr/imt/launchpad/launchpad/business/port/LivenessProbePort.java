package fr.imt.launchpad.launchpad.business.port;

public interface LivenessProbePort {

    /**
     * @return true when the endpoint answered with a success status
     */
    boolean isLive(String url);
}
