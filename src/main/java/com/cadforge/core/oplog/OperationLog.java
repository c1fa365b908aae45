package com.cadforge.core.oplog;

import com.cadforge.core.model.ConstraintChange;
import com.cadforge.core.model.EntityChange;
import com.cadforge.core.model.OperationRecord;
import com.cadforge.core.model.OperationType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only per-workspace operation history. Sequences start at 1 and
 * increase by one per record. Appends must happen under the workspace lock.
 */
@Component
public class OperationLog {

    private final Map<String, List<OperationRecord>> logs = new ConcurrentHashMap<>();
    private final Clock clock;

    public OperationLog(Clock clock) {
        this.clock = clock;
    }

    public void register(String workspaceId) {
        logs.putIfAbsent(workspaceId, new CopyOnWriteArrayList<>());
    }

    public void drop(String workspaceId) {
        logs.remove(workspaceId);
    }

    /** Sequence of the latest record, 0 for an empty log. */
    public long head(String workspaceId) {
        return records(workspaceId).size();
    }

    public long nextSequence(String workspaceId) {
        return head(workspaceId) + 1;
    }

    public OperationRecord append(String workspaceId,
                                  OperationType type,
                                  String agentId,
                                  List<String> entityIds,
                                  List<EntityChange> entityChanges,
                                  List<ConstraintChange> constraintChanges,
                                  String revertsOperationId) {
        List<OperationRecord> records = records(workspaceId);
        var record = new OperationRecord(
                records.size() + 1L,
                "op_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12),
                workspaceId,
                type,
                agentId,
                clock.instant(),
                entityIds,
                entityChanges,
                constraintChanges,
                revertsOperationId);
        records.add(record);
        return record;
    }

    /**
     * Records newest first.
     */
    public List<OperationRecord> list(String workspaceId, int limit, int offset) {
        List<OperationRecord> records = records(workspaceId);
        List<OperationRecord> page = new ArrayList<>();
        for (int i = records.size() - 1 - Math.max(offset, 0); i >= 0 && page.size() < limit; i--) {
            page.add(records.get(i));
        }
        return page;
    }

    /**
     * Records with a sequence strictly greater than {@code afterSequence}, oldest first.
     */
    public List<OperationRecord> since(String workspaceId, long afterSequence) {
        List<OperationRecord> records = records(workspaceId);
        int from = (int) Math.min(Math.max(afterSequence, 0), records.size());
        return List.copyOf(records.subList(from, records.size()));
    }

    /**
     * The most recent record that is neither an undo nor already reverted.
     */
    public Optional<OperationRecord> latestUndoable(String workspaceId) {
        List<OperationRecord> records = records(workspaceId);
        Set<String> reverted = new HashSet<>();
        for (int i = records.size() - 1; i >= 0; i--) {
            OperationRecord record = records.get(i);
            if (record.type() == OperationType.UNDO) {
                reverted.add(record.revertsOperationId());
            } else if (!reverted.contains(record.operationId())) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    private List<OperationRecord> records(String workspaceId) {
        List<OperationRecord> records = logs.get(workspaceId);
        if (records == null) {
            throw new IllegalStateException("No operation log for workspace " + workspaceId);
        }
        return records;
    }
}
