package com.teamflow.core.stall;

import com.teamflow.core.model.BlockedTaskRecord;
import com.teamflow.core.persistence.CoordinationRepository;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live blocked-task records keyed by issue id, written through to the context store.
 * A replacement record must not lower the escalation level; only {@link #recovered} removes one.
 */
@Service
public class BlockedTaskRegistry {

    private final Map<String, BlockedTaskRecord> records = new ConcurrentHashMap<>();
    private final CoordinationRepository repository;

    public BlockedTaskRegistry(CoordinationRepository repository) {
        this.repository = repository;
    }

    public Optional<BlockedTaskRecord> find(String issueId) {
        return Optional.ofNullable(records.get(issueId));
    }

    public BlockedTaskRecord save(BlockedTaskRecord record) {
        records.compute(record.issueId(), (id, existing) -> {
            if (existing != null && record.level() < existing.level()) {
                throw new IllegalStateException("Escalation level for " + id + " cannot go from "
                        + existing.stage() + " back to " + record.stage());
            }
            return record;
        });
        repository.saveBlocked(record);
        return record;
    }

    /** Fresh activity was observed: the record is deleted. */
    public boolean recovered(String issueId) {
        BlockedTaskRecord removed = records.remove(issueId);
        if (removed == null) {
            return false;
        }
        repository.deleteBlocked(removed.epicId(), issueId);
        return true;
    }

    public List<BlockedTaskRecord> forEpic(String epicId) {
        return records.values().stream()
                .filter(r -> r.epicId().equals(epicId))
                .sorted(Comparator.comparing(BlockedTaskRecord::detectedAt))
                .toList();
    }

    public List<BlockedTaskRecord> all() {
        return records.values().stream()
                .sorted(Comparator.comparing(BlockedTaskRecord::detectedAt))
                .toList();
    }

    public void restore(Collection<BlockedTaskRecord> restored) {
        restored.forEach(r -> records.merge(r.issueId(), r, (a, b) -> a.level() >= b.level() ? a : b));
    }

    public void removeEpic(String epicId) {
        records.values().removeIf(r -> r.epicId().equals(epicId));
    }
}
