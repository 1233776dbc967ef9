package com.publicdomain.matching.batch;

import com.publicdomain.matching.config.MatchParameters;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Unit of work handed to a worker. Carries a file handle, not the records themselves.
 *
 * @param batchId         1-based batch number
 * @param handle          spooled input records
 * @param parameters      matching parameters for the run
 * @param resultDirectory where the result and stats files go
 */
public record BatchJob(int batchId, BatchHandle handle, MatchParameters parameters, Path resultDirectory) {

    public BatchJob {
        Objects.requireNonNull(handle, "handle is required");
        Objects.requireNonNull(parameters, "parameters is required");
        Objects.requireNonNull(resultDirectory, "resultDirectory is required");
    }

    public int size() {
        return handle.getSize();
    }
}
