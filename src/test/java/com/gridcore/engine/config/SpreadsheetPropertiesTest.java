package com.gridcore.engine.config;

import com.gridcore.engine.EngineApplication;
import com.gridcore.engine.models.CellAddress;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binding of the gridcore.* keys, with the test profile overrides applied.
 */
@SpringBootTest(classes = EngineApplication.class)
@ActiveProfiles("test")
class SpreadsheetPropertiesTest {

    @Autowired
    SpreadsheetProperties properties;

    @Test
    void testBoundValues() {
        EngineSettings settings = properties.toEngineSettings();
        assertEquals(50, settings.getUndoMaxDepth());
        assertEquals(20, settings.getPreviewLimit());
        assertEquals(1_000_000, settings.getMaxSelectionCells());
        assertEquals(CellAddress.MAX_ROWS, settings.getMaxRows());
        assertEquals(CellAddress.MAX_COLUMNS, settings.getMaxColumns());
    }

    @Test
    void testInvalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineSettings.defaults().withUndoMaxDepth(0));
        assertThrows(IllegalArgumentException.class,
                () -> EngineSettings.defaults().withLimits(CellAddress.MAX_ROWS + 1, 10));
        assertThrows(IllegalArgumentException.class, () -> new EngineSettings(10, 10, 10, 0, 10));
    }
}
