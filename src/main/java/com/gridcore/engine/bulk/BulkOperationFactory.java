package com.gridcore.engine.bulk;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridcore.engine.exceptions.BulkValidationException;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;

import java.util.Collections;
import java.util.Map;

/**
 * Builds bulk operations from a kind name and a loose options map, converting the
 * map into the kind's typed options with Jackson.
 */
public class BulkOperationFactory {

    private final SpreadsheetEngine engine;
    private final ObjectMapper mapper;

    public BulkOperationFactory(SpreadsheetEngine engine) {
        this.engine = engine;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Returns null when the kind is not supported.
     *
     * @throws BulkValidationException when the options cannot be converted
     */
    public BulkOperation createOperation(String kind, Selection selection, Map<String, Object> options) {
        return createOperation(BulkOperationKind.fromValue(kind), selection, options);
    }

    public BulkOperation createOperation(BulkOperationKind kind, Selection selection, Map<String, Object> options) {
        if (kind == null) {
            return null;
        }
        Map<String, Object> raw = options == null ? Collections.emptyMap() : options;
        switch (kind) {
            case FIND_REPLACE:
                return new FindReplaceOperation(engine, selection, convert(raw, FindReplaceOptions.class));
            case BULK_SET:
                return new BulkSetOperation(engine, selection, convert(raw, BulkSetOptions.class));
            case MATH_OPERATION:
                return new MathOperation(engine, selection, convert(raw, MathOptions.class));
            case FILL:
                return new FillOperation(engine, selection, convert(raw, FillOptions.class));
            case TRANSFORM:
                return new TransformOperation(engine, selection, convert(raw, TransformOptions.class));
            case FORMAT:
                return new FormatOperation(engine, selection, convert(raw, FormatOptions.class));
            default:
                return null;
        }
    }

    private <T> T convert(Map<String, Object> options, Class<T> type) {
        try {
            return mapper.convertValue(options, type);
        } catch (IllegalArgumentException e) {
            throw new BulkValidationException("Invalid " + type.getSimpleName() + ": " + e.getMessage());
        }
    }
}
