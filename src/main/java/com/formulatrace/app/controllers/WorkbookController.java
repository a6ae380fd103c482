package com.formulatrace.app.controllers;

import com.formulatrace.app.models.CellSnapshot;
import com.formulatrace.app.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for editing the in-memory workbook.
 * "/workbook" is the base path.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbook/sheets
     * Expects a JSON body { "name": "Sheet1" }.
     * Creates the sheet if it doesn't exist yet and returns its name.
     */
    @PostMapping("/sheets")
    public ResponseEntity<String> createSheet(@RequestBody Map<String, String> request) {
        String name = workbookService.createSheet(request.get("name"));
        return ResponseEntity.ok(name);
    }

    /**
     * GET /workbook/sheets
     * Returns sheet names in workbook order.
     */
    @GetMapping("/sheets")
    public ResponseEntity<List<String>> listSheets() {
        return ResponseEntity.ok(workbookService.listSheetNames());
    }

    /**
     * PUT /workbook/sheets/{sheet}/cells/{address}
     * Body: raw input (literal, or a formula starting with "=").
     * An empty body clears the cell.
     */
    @PutMapping("/sheets/{sheet}/cells/{address}")
    public ResponseEntity<CellSnapshot> setCell(
            @PathVariable String sheet,
            @PathVariable String address,
            @RequestParam(required = false) String numberFormat,
            @RequestBody(required = false) String rawInput
    ) {
        return ResponseEntity.ok(workbookService.setCellValue(sheet, address, rawInput, numberFormat));
    }

    /**
     * GET /workbook/sheets/{sheet}/cells/{address}
     * Returns the cell's value, formula and number format.
     */
    @GetMapping("/sheets/{sheet}/cells/{address}")
    public ResponseEntity<CellSnapshot> getCell(@PathVariable String sheet, @PathVariable String address) {
        return ResponseEntity.ok(workbookService.getCell(sheet, address));
    }
}
