package com.publicdomain.matching.batch;

import com.publicdomain.matching.index.IndexBundle;
import com.publicdomain.matching.matching.CoreMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * State owned by one worker: its indexes, its matcher and how many batches it has run.
 * Used only by the thread that created it and passed explicitly to every call.
 */
public class WorkerContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerContext.class);

    private final String workerId;
    private final IndexBundle indexes;
    private final CoreMatcher matcher;
    private int batchesHandled;
    private boolean closed;

    public WorkerContext(String workerId, IndexBundle indexes, CoreMatcher matcher) {
        this.workerId = Objects.requireNonNull(workerId, "workerId is required");
        this.indexes = Objects.requireNonNull(indexes, "indexes is required");
        this.matcher = Objects.requireNonNull(matcher, "matcher is required");
    }

    public String getWorkerId() {
        return workerId;
    }

    public IndexBundle getIndexes() {
        return indexes;
    }

    public CoreMatcher getMatcher() {
        return matcher;
    }

    public int getBatchesHandled() {
        return batchesHandled;
    }

    void batchHandled() {
        batchesHandled++;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.debug("worker.contextClosed workerId={} batches={}", workerId, batchesHandled);
        }
    }
}
