package com.genomics.repository;

import com.genomics.model.GeneRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(prefix = "genomics.store", name = "backend", havingValue = "relational", matchIfMissing = true)
public class GeneRecordRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<GeneRecord> GENE_RECORD_MAPPER = (rs, rowNum) -> new GeneRecord(
        rs.getString("patient_id"),
        rs.getString("gene_id"),
        rs.getDouble("expression"),
        rs.getString("raw_sequence")
    );

    public GeneRecordRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<GeneRecord> findById(String id) {
        List<GeneRecord> results = jdbc.query(
            "SELECT * FROM gene_records WHERE id = ?",
            GENE_RECORD_MAPPER,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<GeneRecord> findAll() {
        return jdbc.query("SELECT * FROM gene_records", GENE_RECORD_MAPPER);
    }

    public boolean exists(String id) {
        Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM gene_records WHERE id = ?", Integer.class, id);
        return count != null && count > 0;
    }

    public void insert(GeneRecord record) {
        jdbc.update("""
            INSERT INTO gene_records (id, patient_id, gene_id, expression, raw_sequence)
            VALUES (?, ?, ?, ?, ?)
            """,
            record.id(), record.patientId(), record.geneId(), record.expression(), record.sequence()
        );
    }

    public void update(GeneRecord record) {
        jdbc.update("UPDATE gene_records SET expression = ?, raw_sequence = ? WHERE id = ?",
            record.expression(), record.sequence(), record.id());
    }

    public int delete(String id) {
        jdbc.update("DELETE FROM mutation_records WHERE gene_record_id = ?", id);
        return jdbc.update("DELETE FROM gene_records WHERE id = ?", id);
    }
}
