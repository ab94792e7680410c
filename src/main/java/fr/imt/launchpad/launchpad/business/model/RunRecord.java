package fr.imt.launchpad.launchpad.business.model;

/**
 * A run as seen by the history: its live context and, once finished, its outcome.
 */
public record RunRecord(RunContext context, RunOutcome outcome) {

    public static RunRecord started(RunContext context) {
        return new RunRecord(context, null);
    }

    public RunRecord finish(RunOutcome outcome) {
        return new RunRecord(context, outcome);
    }

    public String runId() {
        return context.getRunId();
    }

    public boolean isFinished() {
        return outcome != null;
    }
}
