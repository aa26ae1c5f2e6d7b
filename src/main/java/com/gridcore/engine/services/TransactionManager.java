package com.gridcore.engine.services;

import com.gridcore.engine.exceptions.BatchNotFoundException;
import com.gridcore.engine.exceptions.BatchStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Holds at most one open batch and buffers its mutations until commit or rollback.
 * Applying the mutations is the engine's job; this class only owns the batch lifecycle.
 */
public class TransactionManager {

    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private final AtomicLong idGenerator = new AtomicLong(1);
    private Transaction active;

    /**
     * Opens a batch. A null or blank id gets a generated "batch-N" id.
     */
    public String beginBatch(String id) {
        if (active != null) {
            throw BatchStateException.alreadyOpen(active.getId());
        }
        String batchId = id == null || id.isBlank() ? "batch-" + idGenerator.getAndIncrement() : id;
        active = new Transaction(batchId);
        logger.debug("Opened batch {}", batchId);
        return batchId;
    }

    public boolean isOpen() {
        return active != null;
    }

    public String getActiveId() {
        return active == null ? null : active.getId();
    }

    public void record(Mutation mutation) {
        if (active == null) {
            throw new IllegalStateException("No batch is open");
        }
        active.record(mutation);
    }

    /**
     * Closes the batch and hands back its recorded mutations for application.
     */
    public Transaction commit(String id) {
        Transaction transaction = close(id);
        logger.debug("Committing batch {} with {} mutations", id, transaction.getMutations().size());
        return transaction;
    }

    /**
     * Closes the batch and discards its mutations.
     */
    public Transaction rollback(String id) {
        Transaction transaction = close(id);
        logger.info("Rolled back batch {} ({} mutations discarded)", id, transaction.getMutations().size());
        return transaction;
    }

    private Transaction close(String id) {
        if (active == null || !active.getId().equals(id)) {
            throw new BatchNotFoundException("No open batch with id " + id);
        }
        Transaction transaction = active;
        active = null;
        return transaction;
    }
}
