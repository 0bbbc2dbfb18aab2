package com.genomics.controller;

import com.genomics.service.ImportOptions;
import com.genomics.service.ImportReport;
import com.genomics.service.RecordImportService;
import com.genomics.validation.ErrorPolicy;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepts rows already parsed from CSV by the front-end, one JSON object per row.
 */
@RestController
@RequestMapping("/api/import")
public class ImportApiController {

    private final RecordImportService importService;

    public ImportApiController(RecordImportService importService) {
        this.importService = importService;
    }

    @PostMapping
    public Map<String, Object> importRows(
            @RequestBody List<Map<String, Object>> rows,
            @RequestParam(defaultValue = "false") boolean replace,
            @RequestParam(defaultValue = "false") boolean stopAtFirstError,
            @RequestParam(defaultValue = "false") boolean atomic) {

        ImportReport report;
        if (atomic) {
            report = importService.importAtomically(rows, replace);
        } else {
            ErrorPolicy policy = stopAtFirstError ? ErrorPolicy.STOP_AT_FIRST : ErrorPolicy.COLLECT_ALL;
            report = importService.importRows(rows, new ImportOptions(replace, policy));
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("succeeded", report.succeeded());
        response.put("failed", report.failed());
        response.put("rows", report.rows());
        return response;
    }
}
