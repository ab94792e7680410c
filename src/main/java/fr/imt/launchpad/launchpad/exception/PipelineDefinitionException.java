package fr.imt.launchpad.launchpad.exception;

import fr.imt.launchpad.launchpad.business.model.FailureKind;

/**
 * Exception thrown when a pipeline cannot be assembled from its declaration.
 */
public class PipelineDefinitionException extends LaunchpadException {

    private static final String ERROR_CODE = "DEFINITION_ERR";

    public PipelineDefinitionException(String message) {
        super(ERROR_CODE, FailureKind.WORK_FAILED, message);
    }
}
