package com.genomics.repository;

import com.genomics.model.ClinicalStage;
import com.genomics.model.Patient;
import com.genomics.model.Sex;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

@Repository
@ConditionalOnProperty(prefix = "genomics.store", name = "backend", havingValue = "relational", matchIfMissing = true)
public class PatientRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<Patient> PATIENT_MAPPER = (rs, rowNum) -> new Patient(
        rs.getString("id"),
        rs.getString("name"),
        rs.getObject("age") != null ? rs.getInt("age") : null,
        rs.getString("sex") != null ? Sex.valueOf(rs.getString("sex")) : null,
        rs.getString("clinical_stage") != null ? ClinicalStage.valueOf(rs.getString("clinical_stage")) : null,
        rs.getString("diagnosis")
    );

    public PatientRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<Patient> findById(String id) {
        List<Patient> results = jdbc.query(
            "SELECT * FROM patients WHERE id = ?",
            PATIENT_MAPPER,
            id
        );
        return results.isEmpty()
            ? Optional.empty()
            : Optional.of(results.get(0).withGeneIds(findGeneIds(id)));
    }

    public List<Patient> findAll() {
        Map<String, List<String>> geneIds = findAllGeneIds();
        return jdbc.query("SELECT * FROM patients", PATIENT_MAPPER).stream()
            .map(p -> p.withGeneIds(geneIds.getOrDefault(p.id(), List.of())))
            .toList();
    }

    public boolean exists(String id) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM patients WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public void save(Patient patient) {
        int updated = jdbc.update("""
            UPDATE patients SET name = ?, age = ?, sex = ?, clinical_stage = ?, diagnosis = ?
            WHERE id = ?
            """,
            patient.name(), patient.age(), enumName(patient.sex()), enumName(patient.stage()),
            patient.diagnosis(), patient.id()
        );
        if (updated == 0) {
            insert(patient);
        }
    }

    public void insert(Patient patient) {
        jdbc.update("""
            INSERT INTO patients (id, name, age, sex, clinical_stage, diagnosis)
            VALUES (?, ?, ?, ?, ?, ?)
            """,
            patient.id(), patient.name(), patient.age(), enumName(patient.sex()),
            enumName(patient.stage()), patient.diagnosis()
        );
    }

    public int delete(String id) {
        // Children first so the cascade does not depend on the FK definition
        jdbc.update("""
            DELETE FROM mutation_records
            WHERE gene_record_id IN (SELECT id FROM gene_records WHERE patient_id = ?)
            """, id);
        jdbc.update("DELETE FROM gene_records WHERE patient_id = ?", id);
        return jdbc.update("DELETE FROM patients WHERE id = ?", id);
    }

    private List<String> findGeneIds(String patientId) {
        return jdbc.queryForList(
            "SELECT gene_id FROM gene_records WHERE patient_id = ?",
            String.class,
            patientId
        );
    }

    private Map<String, List<String>> findAllGeneIds() {
        Map<String, List<String>> byPatient = new TreeMap<>();
        jdbc.query("SELECT patient_id, gene_id FROM gene_records", rs -> {
            byPatient.computeIfAbsent(rs.getString("patient_id"), k -> new ArrayList<>())
                .add(rs.getString("gene_id"));
        });
        return byPatient;
    }

    private static String enumName(Enum<?> value) {
        return value != null ? value.name() : null;
    }
}
