package fr.imt.launchpad.launchpad.business.model;

/**
 * Action run after the stage sequence concludes.
 */
@FunctionalInterface
public interface PostAction {

    PostAction NONE = (status, context) -> { };

    void run(RunStatus status, RunContext context) throws Exception;

}
