package com.genomics.controller;

import com.genomics.error.ValidationException;
import com.genomics.model.GeneRecord;
import com.genomics.model.MutationRecord;
import com.genomics.model.Patient;
import com.genomics.service.PatientService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/patients")
public class PatientApiController {

    private final PatientService patientService;

    public PatientApiController(PatientService patientService) {
        this.patientService = patientService;
    }

    // ========== READ OPERATIONS ==========

    @GetMapping
    public List<Patient> listPatients(@RequestParam(required = false) String diagnosis) {
        if (diagnosis == null || diagnosis.isBlank()) {
            return patientService.findAll();
        }
        return patientService.findByDiagnosis(diagnosis);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> getPatient(@PathVariable String id) {
        return patientService.getPatient(id)
            .map(patient -> {
                Map<String, Object> response = new LinkedHashMap<>();
                response.put("patient", patient);
                response.put("geneRecords", patientService.geneRecordsFor(id));
                response.put("mutationRecords", patientService.mutationRecordsFor(id));
                return ResponseEntity.ok(response);
            })
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/genes")
    public ResponseEntity<List<GeneRecord>> getGeneRecords(@PathVariable String id) {
        if (patientService.getPatient(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(patientService.geneRecordsFor(id));
    }

    @GetMapping("/{id}/mutations")
    public ResponseEntity<List<MutationRecord>> getMutationRecords(@PathVariable String id) {
        if (patientService.getPatient(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(patientService.mutationRecordsFor(id));
    }

    // ========== CREATE/UPDATE/DELETE ==========

    @PostMapping
    public ResponseEntity<Map<String, Object>> createPatient(@RequestBody Map<String, Object> body) {
        return patientService.createPatient(body)
            .map(patient -> ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.<String, Object>of("id", patient.id(), "patient", patient)))
            .orElse(ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "DUPLICATE", "message", "patient already exists")));
    }

    @PutMapping("/{id}")
    public ResponseEntity<Map<String, Object>> updatePatient(@PathVariable String id,
                                                             @RequestBody Map<String, Object> body) {
        return patientService.updatePatient(id, body)
            .map(patient -> ResponseEntity.ok(Map.<String, Object>of("id", id, "patient", patient)))
            .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePatient(@PathVariable String id) {
        if (!patientService.deletePatient(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Record a gene measurement for the patient and return the mutation record
     * derived from it.
     */
    @PostMapping("/{id}/genes")
    public ResponseEntity<MutationRecord> addGeneRecord(@PathVariable String id,
                                                        @RequestBody Map<String, Object> body,
                                                        @RequestParam(defaultValue = "false") boolean replace) {
        String geneId = body.get("geneId") != null ? body.get("geneId").toString() : (String) body.get("gene_id");
        String sequence = (String) body.get("sequence");
        MutationRecord mutation = patientService.addGeneRecord(id, geneId, toExpression(body.get("expression")),
                                                               sequence, replace);
        return ResponseEntity.status(HttpStatus.CREATED).body(mutation);
    }

    private static double toExpression(Object value) {
        if (value == null) {
            throw new ValidationException("expression", "is required");
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return new BigDecimal(value.toString().trim()).doubleValue();
        } catch (NumberFormatException e) {
            throw new ValidationException("expression", "not a number: '" + value + "'");
        }
    }
}
