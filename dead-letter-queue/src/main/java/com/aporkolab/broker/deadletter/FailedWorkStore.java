package com.aporkolab.broker.deadletter;

import java.util.List;
import java.util.Optional;

/**
 * Terminal failure store keyed by work id. Saving an existing id replaces the record.
 */
public interface FailedWorkStore {

    void save(FailedWork failedWork);

    Optional<FailedWork> find(String workId);

    Optional<FailedWork> remove(String workId);

    /**
     * All records, oldest failure first.
     */
    List<FailedWork> findAll();

    int size();
}
