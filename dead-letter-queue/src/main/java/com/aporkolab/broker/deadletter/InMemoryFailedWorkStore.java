package com.aporkolab.broker.deadletter;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store; records are lost on restart.
 */
public class InMemoryFailedWorkStore implements FailedWorkStore {

    private final Map<String, FailedWork> records = new ConcurrentHashMap<>();

    @Override
    public void save(FailedWork failedWork) {
        records.put(failedWork.getWorkId(), failedWork);
    }

    @Override
    public Optional<FailedWork> find(String workId) {
        return Optional.ofNullable(records.get(workId));
    }

    @Override
    public Optional<FailedWork> remove(String workId) {
        return Optional.ofNullable(records.remove(workId));
    }

    @Override
    public List<FailedWork> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(FailedWork::getFailedAt,
                        Comparator.nullsLast(Comparator.<Instant>naturalOrder())))
                .toList();
    }

    @Override
    public int size() {
        return records.size();
    }
}
