package com.di.qualitygate.store.jdbc;

import com.di.qualitygate.model.QuarantineRecord;
import com.di.qualitygate.sql.SqlQueriesProperties;
import com.di.qualitygate.store.QuarantineSummaryRow;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("JdbcQuarantineSink Tests")
class JdbcQuarantineSinkTest {

    private static final Instant NOW = Instant.parse("2024-06-15T10:00:00Z");

    private JdbcTemplate jdbc;
    private JdbcQuarantineSink sink;

    @BeforeEach
    void setUp() {
        jdbc = mock(JdbcTemplate.class);
        SqlQueriesProperties sql = new SqlQueriesProperties();
        sql.getQuarantine().setTruncate("TRUNCATE TABLE silver.quality_quarantine");
        sql.getQuarantine().setInsert("INSERT INTO silver.quality_quarantine VALUES (?, ?, ?, CAST(? AS jsonb), ?)");
        sql.getQuarantine().setSummary("SELECT summary");
        sink = new JdbcQuarantineSink(jdbc, sql, new ObjectMapper());
    }

    @Test
    @DisplayName("Should truncate on clear")
    void testClear() {
        sink.clear();
        verify(jdbc).update("TRUNCATE TABLE silver.quality_quarantine");
    }

    @Test
    @DisplayName("Should batch insert rows with a JSON payload in column order")
    @SuppressWarnings("unchecked")
    void testAppend() {
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put("cst_id", null);
        raw.put("cst_key", "AW00011002");
        sink.append(List.of(QuarantineRecord.builder()
                .sourceTable("bronze.crm_cust_info")
                .rejectedColumn("cst_id")
                .rejectedReason("Missing Mandatory Key")
                .rawData(raw)
                .dwhInsertionDate(NOW)
                .build()));

        ArgumentCaptor<List<Object[]>> batch = ArgumentCaptor.forClass(List.class);
        verify(jdbc).batchUpdate(eq("INSERT INTO silver.quality_quarantine VALUES (?, ?, ?, CAST(? AS jsonb), ?)"), batch.capture());
        Object[] args = batch.getValue().get(0);
        assertEquals("bronze.crm_cust_info", args[0]);
        assertEquals("cst_id", args[1]);
        assertEquals("Missing Mandatory Key", args[2]);
        assertEquals("{\"cst_id\":null,\"cst_key\":\"AW00011002\"}", args[3]);
        assertEquals(Timestamp.from(NOW), args[4]);
    }

    @Test
    @DisplayName("Should skip the database for an empty append")
    void testAppend_Empty() {
        sink.append(List.of());
        verify(jdbc, never()).batchUpdate(anyString(), anyList());
    }

    @Test
    @DisplayName("Should map the summary query")
    @SuppressWarnings("unchecked")
    void testSummarize() {
        List<QuarantineSummaryRow> rows = List.of(new QuarantineSummaryRow("bronze.crm_cust_info", "Duplicate Record", 2));
        when(jdbc.query(eq("SELECT summary"), any(RowMapper.class))).thenReturn(rows);

        assertEquals(rows, sink.summarize());
    }
}
