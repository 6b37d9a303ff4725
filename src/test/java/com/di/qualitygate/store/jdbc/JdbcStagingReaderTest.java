package com.di.qualitygate.store.jdbc;

import com.di.qualitygate.model.RawRecord;
import com.di.qualitygate.model.SourceEntity;
import com.di.qualitygate.sql.SqlQueriesProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("JdbcStagingReader Tests")
class JdbcStagingReaderTest {

    @Test
    @DisplayName("Should read every column as verbatim text with increasing ordinals")
    void testReadAll() throws Exception {
        JdbcTemplate jdbc = mock(JdbcTemplate.class);
        SqlQueriesProperties sql = new SqlQueriesProperties();
        sql.getStaging().getSelect().put("erp-location", "SELECT cid, cntry FROM bronze.erp_loc_a101");

        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(meta.getColumnCount()).thenReturn(2);
        when(meta.getColumnLabel(1)).thenReturn("CID");
        when(meta.getColumnLabel(2)).thenReturn("cntry");
        ResultSet rs = mock(ResultSet.class);
        when(rs.getMetaData()).thenReturn(meta);
        when(rs.getString(1)).thenReturn("AW-00011000", "AW-00011001");
        when(rs.getString(2)).thenReturn(" DE", null);

        doAnswer(inv -> {
            RowCallbackHandler handler = inv.getArgument(1);
            handler.processRow(rs);
            handler.processRow(rs);
            return null;
        }).when(jdbc).query(eq("SELECT cid, cntry FROM bronze.erp_loc_a101"), any(RowCallbackHandler.class));

        List<RawRecord> rows = new JdbcStagingReader(jdbc, sql).readAll(SourceEntity.ERP_LOCATION);

        assertEquals(2, rows.size());
        assertEquals(1L, rows.get(0).getOrdinal());
        assertEquals(2L, rows.get(1).getOrdinal());
        assertEquals("AW-00011000", rows.get(0).raw("cid"));
        assertEquals(" DE", rows.get(0).raw("cntry"));
        assertNull(rows.get(1).raw("cntry"));
        assertTrue(rows.get(1).getFields().containsKey("cntry"));
    }

    @Test
    @DisplayName("Should fail when the entity has no staging query")
    void testReadAll_MissingSql() {
        JdbcStagingReader reader = new JdbcStagingReader(mock(JdbcTemplate.class), new SqlQueriesProperties());
        assertThrows(IllegalStateException.class, () -> reader.readAll(SourceEntity.CUSTOMER));
    }
}
