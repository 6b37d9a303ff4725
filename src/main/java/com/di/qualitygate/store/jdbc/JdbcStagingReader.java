package com.di.qualitygate.store.jdbc;

import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.sql.SqlQueriesProperties;
import com.di.qualitygate.store.StagingReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads staging tables column by column as text. Column names are lower-cased;
 * values are kept verbatim.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "qualitygate.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcStagingReader implements StagingReader {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcStagingReader(JdbcTemplate jdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = jdbcTemplate;
        this.sql = sql;
    }

    @Override
    public List<RawRecord> readAll(SourceEntity entity) {
        String query = SqlQueriesProperties.require(sql.getStaging().getSelect(), "staging.select", entity.configKey());
        List<RawRecord> rows = new ArrayList<>();
        jdbc.query(query, (RowCallbackHandler) rs -> {
            ResultSetMetaData meta = rs.getMetaData();
            Map<String, String> fields = new LinkedHashMap<>();
            for (int i = 1; i <= meta.getColumnCount(); i++) {
                fields.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), rs.getString(i));
            }
            rows.add(new RawRecord(entity, rows.size() + 1L, fields));
        });
        log.debug("[STAGING] {} rows read from {}", rows.size(), entity.stagingTable());
        return rows;
    }
}
