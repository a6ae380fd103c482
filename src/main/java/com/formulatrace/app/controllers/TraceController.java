package com.formulatrace.app.controllers;

import com.formulatrace.app.formula.FormulaReferenceParser;
import com.formulatrace.app.models.ParsedReference;
import com.formulatrace.app.models.TraceResult;
import com.formulatrace.app.services.DependencyTraceService;
import com.formulatrace.app.services.DependencyTreeRenderer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST endpoints for formula lineage.
 */
@RestController
public class TraceController {

    @Autowired
    private DependencyTraceService traceService;

    @Autowired
    private DependencyTreeRenderer renderer;

    /**
     * GET /trace?cell=Sheet1!D10&mode=dependents&depth=3
     * mode defaults to precedents, depth to 2 (max 5).
     * A precedents trace of a plain value returns root = null and a message.
     */
    @GetMapping("/trace")
    public ResponseEntity<TraceResult> trace(
            @RequestParam String cell,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) Integer depth
    ) {
        return ResponseEntity.ok(traceService.trace(cell, mode, depth));
    }

    /**
     * GET /trace/tree?cell=...
     * Same trace, rendered as a text tree.
     */
    @GetMapping(value = "/trace/tree", produces = "text/plain;charset=UTF-8")
    public ResponseEntity<String> traceTree(
            @RequestParam String cell,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) Integer depth
    ) {
        TraceResult result = traceService.trace(cell, mode, depth);
        return ResponseEntity.ok(renderer.render(result));
    }

    /**
     * GET /references?formula==SUM(A1:B2)&sheet=Calc
     * Lists the references a formula makes, resolved against sheet.
     */
    @GetMapping("/references")
    public ResponseEntity<List<ParsedReference>> references(
            @RequestParam String formula,
            @RequestParam String sheet
    ) {
        return ResponseEntity.ok(FormulaReferenceParser.extractReferences(formula, sheet));
    }
}
