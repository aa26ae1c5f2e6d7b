package com.gridcore.engine.events;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    CELL_UPDATE("cell:update"),
    BATCH_COMPLETE("batch:complete"),
    CALCULATION_COMPLETE("calculation:complete");

    private final String eventName;

    EventType(String eventName) {
        this.eventName = eventName;
    }

    @JsonValue
    public String getEventName() {
        return eventName;
    }
}
