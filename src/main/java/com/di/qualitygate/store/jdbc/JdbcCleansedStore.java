package com.di.qualitygate.store.jdbc;

import com.di.qualitygate.model.CleanRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.sql.SqlQueriesProperties;
import com.di.qualitygate.store.CleansedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Wholesale replace of a silver table: one DELETE, then one batched INSERT.
 * Atomicity comes from the caller's transaction.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "qualitygate.store.type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcCleansedStore implements CleansedStore {

    private final NamedParameterJdbcTemplate jdbc;
    private final SqlQueriesProperties sql;

    public JdbcCleansedStore(NamedParameterJdbcTemplate namedParameterJdbcTemplate, SqlQueriesProperties sql) {
        this.jdbc = namedParameterJdbcTemplate;
        this.sql = sql;
    }

    @Override
    public void replace(SourceEntity entity, List<? extends CleanRecord> records) {
        var statements = sql.getCleansed();
        String delete = SqlQueriesProperties.require(statements.getDelete(), "cleansed.delete", entity.configKey());
        String insert = SqlQueriesProperties.require(statements.getInsert(), "cleansed.insert", entity.configKey());

        int deleted = jdbc.getJdbcTemplate().update(delete);
        if (!records.isEmpty()) {
            SqlParameterSource[] batch = records.stream()
                    .map(r -> toParameters(r.toColumns()))
                    .toArray(SqlParameterSource[]::new);
            jdbc.batchUpdate(insert, batch);
        }
        log.debug("[CLEANSED] {} replaced: {} deleted, {} inserted", entity.cleansedTable(), deleted, records.size());
    }

    @Override
    public long count(SourceEntity entity) {
        String query = SqlQueriesProperties.require(sql.getCleansed().getCount(), "cleansed.count", entity.configKey());
        Long count = jdbc.getJdbcTemplate().queryForObject(query, Long.class);
        return count != null ? count : 0L;
    }

    static MapSqlParameterSource toParameters(Map<String, Object> columns) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        columns.forEach((column, value) -> params.addValue(column,
                value instanceof Instant ? Timestamp.from((Instant) value) : value));
        return params;
    }
}
