package fr.imt.launchpad.launchpad.infrastructure.history;

import fr.imt.launchpad.launchpad.business.model.RunRecord;
import fr.imt.launchpad.launchpad.business.port.RunHistoryPort;
import fr.imt.launchpad.launchpad.configuration.LaunchpadProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the most recent runs in memory; the oldest entry is evicted once the limit is reached.
 */
@Component
public class InMemoryRunHistoryAdapter implements RunHistoryPort {

    private final Map<String, RunRecord> runs;

    public InMemoryRunHistoryAdapter(LaunchpadProperties properties) {
        int maxRuns = Math.max(1, properties.getHistory().getMaxRuns());
        this.runs = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RunRecord> eldest) {
                return size() > maxRuns;
            }
        };
    }

    @Override
    public synchronized RunRecord save(RunRecord record) {
        runs.put(record.runId(), record);
        return record;
    }

    @Override
    public synchronized Optional<RunRecord> findById(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }
}
