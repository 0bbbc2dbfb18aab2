package com.genomics.repository;

import com.genomics.model.Classification;
import com.genomics.model.Evidence;
import com.genomics.model.MutationRecord;
import com.genomics.model.MutationType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(prefix = "genomics.store", name = "backend", havingValue = "relational", matchIfMissing = true)
public class MutationRecordRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<MutationRecord> MUTATION_MAPPER = (rs, rowNum) -> new MutationRecord(
        rs.getString("id"),
        rs.getString("gene_record_id"),
        MutationType.valueOf(rs.getString("mutation_type")),
        Classification.valueOf(rs.getString("classification")),
        Evidence.valueOf(rs.getString("evidence")),
        rs.getObject("variant_position") != null ? rs.getInt("variant_position") : null,
        rs.getString("notation"),
        rs.getString("catalog_version"),
        rs.getString("rule_version"),
        rs.getTimestamp("created_at") != null ? rs.getTimestamp("created_at").toInstant() : null
    );

    public MutationRecordRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<MutationRecord> findById(String id) {
        List<MutationRecord> results = jdbc.query(
            "SELECT * FROM mutation_records WHERE id = ?",
            MUTATION_MAPPER,
            id
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<MutationRecord> findAll() {
        return jdbc.query("SELECT * FROM mutation_records", MUTATION_MAPPER);
    }

    public void insert(MutationRecord record) {
        jdbc.update("""
            INSERT INTO mutation_records (id, gene_record_id, mutation_type, classification, evidence,
                                          variant_position, notation, catalog_version, rule_version, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            record.id(), record.geneRecordId(), record.type().name(), record.classification().name(),
            record.evidence().name(), record.position(), record.notation(),
            record.catalogVersion(), record.ruleVersion(),
            record.createdAt() != null ? Timestamp.from(record.createdAt()) : null
        );
    }

    public int deleteByGeneRecordId(String geneRecordId) {
        return jdbc.update("DELETE FROM mutation_records WHERE gene_record_id = ?", geneRecordId);
    }

    public int delete(String id) {
        return jdbc.update("DELETE FROM mutation_records WHERE id = ?", id);
    }
}
