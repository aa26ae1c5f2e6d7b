package com.gridcore.engine.bulk;

import com.gridcore.engine.config.EngineSettings;
import com.gridcore.engine.exceptions.BatchStateException;
import com.gridcore.engine.exceptions.BulkValidationException;
import com.gridcore.engine.models.CellAddress;
import com.gridcore.engine.models.CellValue;
import com.gridcore.engine.models.Selection;
import com.gridcore.engine.services.SpreadsheetEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BulkOperationFactoryTest {

    private SpreadsheetEngine engine;
    private BulkOperationFactory factory;

    @BeforeEach
    void setUp() {
        engine = new SpreadsheetEngine();
        factory = new BulkOperationFactory(engine);
    }

    @ParameterizedTest
    @ValueSource(strings = {"findReplace", "FINDREPLACE", "find_replace", "find-replace"})
    void testKindNamesAreLoose(String kind) {
        BulkOperation op = factory.createOperation(kind, Selection.parse("A1"), new HashMap<>());
        assertNotNull(op);
        assertEquals(BulkOperationKind.FIND_REPLACE, op.getKind());
    }

    @Test
    void testUnsupportedKind() {
        assertNull(factory.createOperation("sortRows", Selection.parse("A1"), new HashMap<>()));
        assertNull(factory.createOperation((String) null, Selection.parse("A1"), new HashMap<>()));
    }

    @Test
    void testOptionsAreConverted() {
        Map<String, Object> options = new HashMap<>();
        options.put("operation", "percent_decrease");
        options.put("value", 10);
        options.put("unknownFlag", true);
        MathOperation op = (MathOperation) factory.createOperation("mathOperation", Selection.parse("A1"), options);
        assertEquals(MathOperationType.PERCENT_DECREASE, op.getOptions().getOperation());
        assertEquals(10.0, op.getOptions().getValue().doubleValue());

        Map<String, Object> fill = new HashMap<>();
        fill.put("direction", "right");
        FillOperation fillOp = (FillOperation) factory.createOperation("fill", Selection.parse("A1:C1"), fill);
        assertEquals(FillOptions.Direction.RIGHT, fillOp.getOptions().getDirection());
        assertEquals(FillOptions.Pattern.AUTO, fillOp.getOptions().getPattern());
    }

    @Test
    void testBadOptionValue() {
        Map<String, Object> options = new HashMap<>();
        options.put("transformType", "reverse");
        BulkValidationException e = assertThrows(BulkValidationException.class,
                () -> factory.createOperation("transform", Selection.parse("A1"), options));
        assertTrue(e.getMessage().startsWith("Invalid TransformOptions"));
    }

    /**
     * Preview stops at the limit while execute still touches every matching cell.
     */
    @Test
    void testLargeFindReplace() {
        Map<CellAddress, String> values = new LinkedHashMap<>();
        for (int row = 0; row < 10_000; row++) {
            values.put(CellAddress.of(0, row), "v" + row);
        }
        engine.setCellValues(values);

        Map<String, Object> options = new HashMap<>();
        options.put("findPattern", "v");
        options.put("replaceWith", "w");
        BulkOperation op = factory.createOperation("findReplace", Selection.parse("A1:A10000"), options);

        OperationPreview preview = op.preview(100);
        assertEquals(100, preview.getChanges().size());
        assertTrue(preview.isTruncated());
        assertEquals(CellValue.string("v0"), engine.getCellValue("A1"));

        op.execute();
        assertEquals(CellValue.string("w0"), engine.getCellValue("A1"));
        assertEquals(CellValue.string("w9999"), engine.getCellValue("A10000"));
        assertTrue(engine.undo());
        assertEquals(CellValue.string("v9999"), engine.getCellValue("A10000"));
    }

    @Test
    void testSelectionLimit() {
        EngineSettings settings = new EngineSettings(1000, 100, 10, 10, 100);
        SpreadsheetEngine small = new SpreadsheetEngine(settings);
        Map<String, Object> options = new HashMap<>();
        options.put("value", "x");
        BulkOperation op = new BulkOperationFactory(small).createOperation("bulkSet", Selection.parse("A1:J11"), options);
        assertEquals("Selection of 110 cells exceeds the maximum of 100 cells", op.validate());
        assertThrows(BulkValidationException.class, op::preview);
    }

    @Test
    void testExecuteInsideBatchIsRejected() {
        engine.setCellValue("A1", "1");
        Map<String, Object> options = new HashMap<>();
        options.put("value", "2");
        BulkOperation op = factory.createOperation("bulkSet", Selection.parse("A1"), options);
        engine.beginBatch("b1");
        assertThrows(BatchStateException.class, op::execute);
        engine.rollbackBatch("b1");
        op.execute();
        assertEquals(CellValue.number(2), engine.getCellValue("A1"));
    }
}
