package com.publicdomain.matching.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Reference to one spooled batch input file. A batch is read exactly once:
 * CREATED, then CONSUMED when a worker claims it, then DELETED once the file is gone.
 */
public final class BatchHandle {

    public enum State {
        CREATED,
        CONSUMED,
        DELETED
    }

    private final int batchId;
    private final Path file;
    private final int size;
    private State state = State.CREATED;

    public BatchHandle(int batchId, Path file, int size) {
        this.batchId = batchId;
        this.file = Objects.requireNonNull(file, "file is required");
        this.size = size;
    }

    /**
     * Claims the batch for reading.
     *
     * @throws IllegalStateException if the batch was already consumed
     */
    public synchronized void markConsumed() {
        if (state != State.CREATED) {
            throw new IllegalStateException("Batch " + batchId + " already consumed (state=" + state + ")");
        }
        state = State.CONSUMED;
    }

    public synchronized void markDeleted() {
        state = State.DELETED;
    }

    public synchronized State getState() {
        return state;
    }

    public int getBatchId() {
        return batchId;
    }

    public Path getFile() {
        return file;
    }

    public int getSize() {
        return size;
    }

    @Override
    public String toString() {
        return "BatchHandle{batchId=" + batchId + ", size=" + size + ", state=" + getState() + '}';
    }
}
