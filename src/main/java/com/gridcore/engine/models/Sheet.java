package com.gridcore.engine.models;

import com.gridcore.engine.config.EngineSettings;
import com.gridcore.engine.services.SpreadsheetEngine;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Represents a sheet hosted by the service:
 * - Has a unique ID
 * - Owns one SpreadsheetEngine holding its cells, formulas and history
 * - A read/write lock, since the engine itself is single-threaded
 */
public class Sheet {

    // Generates unique IDs for newly created sheets
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final SpreadsheetEngine engine;

    // Lock to prevent race conditions when multiple requests hit the same Sheet
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Sheet(EngineSettings settings) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.engine = new SpreadsheetEngine(settings);
    }

    public long getId() {
        return id;
    }

    public SpreadsheetEngine getEngine() {
        return engine;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }
}
