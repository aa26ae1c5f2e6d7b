package com.gridcore.engine.controllers;

import com.gridcore.engine.bulk.OperationPreview;
import com.gridcore.engine.services.SheetService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Set;

/**
 * REST endpoints for managing spreadsheet Sheets.
 * "/sheet" is the base path.
 */
@RestController
@RequestMapping("/sheet")
public class SheetController {

    @Autowired
    private SheetService sheetService;

    /**
     * POST /sheet
     * Creates a new empty Sheet, returns the sheetId.
     */
    @PostMapping
    public ResponseEntity<Long> createSheet() {
        return ResponseEntity.ok(sheetService.createSheet());
    }

    /**
     * GET /sheet/{sheetId}
     * Returns a map of computed cell values for the sheet,
     * in the format: { "A1": "hello", "B2": 42.0, "C3": "#DIV/0!", ... }.
     */
    @GetMapping("/{sheetId}")
    public ResponseEntity<Map<String, Object>> getSheet(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getSheetData(sheetId));
    }

    @DeleteMapping("/{sheetId}")
    public ResponseEntity<Void> deleteSheet(@PathVariable long sheetId) {
        sheetService.deleteSheet(sheetId);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellResponse> getCell(@PathVariable long sheetId, @PathVariable String address) {
        return ResponseEntity.ok(CellResponse.of(address, sheetService.getCell(sheetId, address)));
    }

    /**
     * PUT /sheet/{sheetId}/cell/{address}
     * Body: raw input ("42", "hello", "=SUM(A1:A3)"); an empty body clears the cell.
     * Parse errors and circular references are turned into a 400 by the GlobalExceptionHandler.
     */
    @PutMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<CellResponse> setCellValue(
            @PathVariable long sheetId,
            @PathVariable String address,
            @RequestBody(required = false) String rawValue
    ) {
        return ResponseEntity.ok(CellResponse.of(address, sheetService.setCellValue(sheetId, address, rawValue)));
    }

    @DeleteMapping("/{sheetId}/cell/{address}")
    public ResponseEntity<Void> deleteCell(@PathVariable long sheetId, @PathVariable String address) {
        sheetService.deleteCell(sheetId, address);
        return ResponseEntity.ok().build();
    }

    // Structural edits take zero-based indexes

    @PostMapping("/{sheetId}/rows/insert")
    public ResponseEntity<Void> insertRows(@PathVariable long sheetId, @RequestParam int index,
                                           @RequestParam(defaultValue = "1") int count) {
        sheetService.insertRows(sheetId, index, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/rows/delete")
    public ResponseEntity<Void> deleteRows(@PathVariable long sheetId, @RequestParam int index,
                                           @RequestParam(defaultValue = "1") int count) {
        sheetService.deleteRows(sheetId, index, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/columns/insert")
    public ResponseEntity<Void> insertColumns(@PathVariable long sheetId, @RequestParam int index,
                                              @RequestParam(defaultValue = "1") int count) {
        sheetService.insertColumns(sheetId, index, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/columns/delete")
    public ResponseEntity<Void> deleteColumns(@PathVariable long sheetId, @RequestParam int index,
                                              @RequestParam(defaultValue = "1") int count) {
        sheetService.deleteColumns(sheetId, index, count);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/undo")
    public ResponseEntity<Map<String, Boolean>> undo(@PathVariable long sheetId) {
        return ResponseEntity.ok(Map.of("applied", sheetService.undo(sheetId)));
    }

    @PostMapping("/{sheetId}/redo")
    public ResponseEntity<Map<String, Boolean>> redo(@PathVariable long sheetId) {
        return ResponseEntity.ok(Map.of("applied", sheetService.redo(sheetId)));
    }

    /**
     * POST /sheet/{sheetId}/batch?id=optionalId
     * Opens a batch and returns { "batchId": "..." }.
     */
    @PostMapping("/{sheetId}/batch")
    public ResponseEntity<Map<String, String>> beginBatch(@PathVariable long sheetId,
                                                          @RequestParam(required = false) String id) {
        return ResponseEntity.ok(Map.of("batchId", sheetService.beginBatch(sheetId, id)));
    }

    @PostMapping("/{sheetId}/batch/{batchId}/commit")
    public ResponseEntity<Map<String, Integer>> commitBatch(@PathVariable long sheetId, @PathVariable String batchId) {
        return ResponseEntity.ok(Map.of("operationCount", sheetService.commitBatch(sheetId, batchId)));
    }

    @PostMapping("/{sheetId}/batch/{batchId}/rollback")
    public ResponseEntity<Void> rollbackBatch(@PathVariable long sheetId, @PathVariable String batchId) {
        sheetService.rollbackBatch(sheetId, batchId);
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{sheetId}/recalculate")
    public ResponseEntity<Map<String, Integer>> recalculate(@PathVariable long sheetId) {
        return ResponseEntity.ok(Map.of("changedCells", sheetService.recalculate(sheetId).size()));
    }

    @PostMapping("/{sheetId}/bulk/preview")
    public ResponseEntity<OperationPreview> previewBulk(@PathVariable long sheetId, @RequestBody BulkRequest request) {
        return ResponseEntity.ok(sheetService.previewBulk(sheetId, request.getKind(), request.getSelection(),
                request.getOptions(), request.getLimit()));
    }

    @PostMapping("/{sheetId}/bulk/execute")
    public ResponseEntity<Map<String, Integer>> executeBulk(@PathVariable long sheetId, @RequestBody BulkRequest request) {
        return ResponseEntity.ok(Map.of("changedCells", sheetService.executeBulk(sheetId, request.getKind(),
                request.getSelection(), request.getOptions())));
    }

    /**
     * GET /sheet/{sheetId}/forwardDependencies
     * For each formula cell, the set of cells it references.
     */
    @GetMapping("/{sheetId}/forwardDependencies")
    public ResponseEntity<Map<String, Set<String>>> getForwardDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getForwardGraph(sheetId));
    }

    /**
     * GET /sheet/{sheetId}/reverseDependencies
     * For each referenced cell, the set of cells that reference it.
     */
    @GetMapping("/{sheetId}/reverseDependencies")
    public ResponseEntity<Map<String, Set<String>>> getReverseDependencyGraph(@PathVariable long sheetId) {
        return ResponseEntity.ok(sheetService.getReverseGraph(sheetId));
    }
}
