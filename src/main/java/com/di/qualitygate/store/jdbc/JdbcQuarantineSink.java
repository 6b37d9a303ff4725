package com.di.qualitygate.store.jdbc;

import com.di.qualitygate.model.QuarantineRecord;
import com.di.qualitygate.sql.SqlQueriesProperties;
import com.di.qualitygate.store.QuarantineSink;
import com.di.qualitygate.store.QuarantineSummaryRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of {@link QuarantineSink} backed by
 * {@code silver.quality_quarantine}. The raw payload is serialized with
 * Jackson and stored as JSONB.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "qualitygate.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcQuarantineSink implements QuarantineSink {

    private static final RowMapper<QuarantineSummaryRow> SUMMARY_ROW_MAPPER = (rs, rowNum) -> QuarantineSummaryRow.builder()
            .sourceTable(rs.getString("source_table"))
            .rejectedReason(rs.getString("rejected_reason"))
            .rejectedCount(rs.getLong("rejected_count"))
            .build();

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;
    private final ObjectMapper objectMapper;

    public JdbcQuarantineSink(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql, ObjectMapper objectMapper) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
        this.objectMapper = objectMapper;
    }

    @Override
    public void clear() {
        jdbc.update(sql.getQuarantine().getTruncate());
        log.debug("[QUARANTINE] cleared");
    }

    @Override
    public void append(List<QuarantineRecord> records) {
        if (records == null || records.isEmpty()) return;
        List<Object[]> batch = new ArrayList<>(records.size());
        for (QuarantineRecord record : records) {
            batch.add(new Object[]{
                    record.getSourceTable(),
                    record.getRejectedColumn(),
                    record.getRejectedReason(),
                    toJson(record),
                    record.getDwhInsertionDate() != null ? Timestamp.from(record.getDwhInsertionDate()) : null
            });
        }
        jdbc.batchUpdate(sql.getQuarantine().getInsert(), batch);
    }

    @Override
    public List<QuarantineSummaryRow> summarize() {
        return jdbc.query(sql.getQuarantine().getSummary(), SUMMARY_ROW_MAPPER);
    }

    private String toJson(QuarantineRecord record) {
        try {
            return objectMapper.writeValueAsString(record.getRawData());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize quarantined row from " + record.getSourceTable(), e);
        }
    }
}
