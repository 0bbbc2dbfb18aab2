package com.genomics.controller;

import com.genomics.model.Patient;
import com.genomics.query.GenomicRow;
import com.genomics.query.QueryEngine;
import com.genomics.query.QueryResult;
import com.genomics.query.RecordFilter;
import com.genomics.query.ReportQuery;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/reports")
public class ReportApiController {

    private final QueryEngine queryEngine;

    public ReportApiController(QueryEngine queryEngine) {
        this.queryEngine = queryEngine;
    }

    /**
     * @param filter null selects every row
     * @param topN   size of the most-mutated ranking, {@link ReportQuery#DEFAULT_TOP_N} when absent
     */
    public record QueryRequest(FilterRequest filter, Integer topN) {

        RecordFilter recordFilter() {
            return filter != null ? filter.toFilter() : RecordFilter.all();
        }
    }

    @PostMapping("/query")
    public QueryResult query(@RequestBody QueryRequest request) {
        int topN = request.topN() != null ? Math.min(request.topN(), 500) : ReportQuery.DEFAULT_TOP_N;
        return queryEngine.query(new ReportQuery(request.recordFilter(), Math.max(topN, 0)));
    }

    @PostMapping("/rows")
    public List<GenomicRow> rows(@RequestBody QueryRequest request) {
        return queryEngine.rows(request.recordFilter());
    }

    @PostMapping("/patients")
    public List<Patient> patients(@RequestBody QueryRequest request) {
        return queryEngine.patients(request.recordFilter());
    }
}
