package fr.imt.launchpad.launchpad.business.port;

import fr.imt.launchpad.launchpad.business.model.RunRecord;

import java.util.Optional;

public interface RunHistoryPort {
    RunRecord save(RunRecord record);
    Optional<RunRecord> findById(String runId);
}
