package com.di.qualitygate.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQL loaded from sql-queries.yml (qualitygate.sql.*).
 * Per-entity statements are keyed by {@link com.di.qualitygate.model.SourceEntity#configKey()}.
 * No SQL is hardcoded in the JDBC store classes.
 */
@Component
@ConfigurationProperties(prefix = "qualitygate.sql")
public class SqlQueriesProperties {

    private Staging staging = new Staging();
    private Cleansed cleansed = new Cleansed();
    private Quarantine quarantine = new Quarantine();

    public Staging getStaging() { return staging; }
    public void setStaging(Staging staging) { this.staging = staging; }
    public Cleansed getCleansed() { return cleansed; }
    public void setCleansed(Cleansed cleansed) { this.cleansed = cleansed; }
    public Quarantine getQuarantine() { return quarantine; }
    public void setQuarantine(Quarantine quarantine) { this.quarantine = quarantine; }

    /** Looks up a per-entity statement, failing with the missing key in the message. */
    public static String require(Map<String, String> statements, String group, String key) {
        String sql = statements.get(key);
        if (sql == null || sql.isBlank()) {
            throw new IllegalStateException("Missing SQL qualitygate.sql." + group + "." + key);
        }
        return sql;
    }

    public static class Staging {
        private Map<String, String> select = new LinkedHashMap<>();
        public Map<String, String> getSelect() { return select; }
        public void setSelect(Map<String, String> select) { this.select = select; }
    }

    public static class Cleansed {
        private Map<String, String> delete = new LinkedHashMap<>();
        private Map<String, String> insert = new LinkedHashMap<>();
        private Map<String, String> count = new LinkedHashMap<>();
        public Map<String, String> getDelete() { return delete; }
        public void setDelete(Map<String, String> delete) { this.delete = delete; }
        public Map<String, String> getInsert() { return insert; }
        public void setInsert(Map<String, String> insert) { this.insert = insert; }
        public Map<String, String> getCount() { return count; }
        public void setCount(Map<String, String> count) { this.count = count; }
    }

    public static class Quarantine {
        private String truncate;
        private String insert;
        private String summary;
        public String getTruncate() { return truncate; }
        public void setTruncate(String truncate) { this.truncate = truncate; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getSummary() { return summary; }
        public void setSummary(String summary) { this.summary = summary; }
    }
}
