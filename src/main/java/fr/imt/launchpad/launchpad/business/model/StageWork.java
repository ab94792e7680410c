package fr.imt.launchpad.launchpad.business.model;

/**
 * Unit of work of a stage. A non-zero exit code fails the stage; a thrown exception aborts it.
 */
@FunctionalInterface
public interface StageWork {

    ProcessResult execute(RunContext context) throws Exception;

}
