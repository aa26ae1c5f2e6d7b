package com.gridcore.engine.events;

/**
 * Receives engine events synchronously, after the mutation that caused them.
 */
@FunctionalInterface
public interface SpreadsheetEventListener {
    void onEvent(SpreadsheetEvent event);
}
