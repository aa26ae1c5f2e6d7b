package com.gridcore.engine.bulk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BulkOperationKind {
    FIND_REPLACE("findReplace"),
    BULK_SET("bulkSet"),
    MATH_OPERATION("mathOperation"),
    FILL("fill"),
    TRANSFORM("transform"),
    FORMAT("format");

    private final String kindName;

    BulkOperationKind(String kindName) {
        this.kindName = kindName;
    }

    @JsonValue
    public String getKindName() {
        return kindName;
    }

    /**
     * Case-insensitive lookup; returns null for unsupported kinds.
     */
    @JsonCreator
    public static BulkOperationKind fromValue(String value) {
        return OptionValues.lookup(BulkOperationKind.class, value);
    }
}
