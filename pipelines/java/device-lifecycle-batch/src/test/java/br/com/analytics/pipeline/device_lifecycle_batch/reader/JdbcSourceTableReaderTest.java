package br.com.analytics.pipeline.device_lifecycle_batch.reader;

import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTable;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcSourceTableReaderTest {

    @Test
    @SuppressWarnings("unchecked")
    void shouldCaptureColumnsAndRows() throws Exception {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        ResultSet resultSet = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(2);
        when(metaData.getColumnLabel(1)).thenReturn("no de série");
        when(metaData.getColumnLabel(2)).thenReturn("RMA");
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getObject(1)).thenReturn("0118001", "0218002");
        when(resultSet.getObject(2)).thenReturn("RMA-1", null);
        when(jdbcTemplate.query(eq("SELECT * FROM returns"), any(ResultSetExtractor.class)))
                .thenAnswer(invocation -> invocation.<ResultSetExtractor<Void>>getArgument(1).extractData(resultSet));

        SourceTable table = new JdbcSourceTableReader(jdbcTemplate).read("returns", "SELECT * FROM returns");

        assertThat(table.name()).isEqualTo("returns");
        assertThat(table.columns()).containsExactly("no de série", "RMA");
        assertThat(table.rows()).extracting(row -> row.text("no de série")).containsExactly("0118001", "0218002");
        assertThat(table.rows().get(1).get("RMA")).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReportColumnsOfEmptyTable() throws Exception {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        ResultSet resultSet = mock(ResultSet.class);
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(1);
        when(metaData.getColumnLabel(1)).thenReturn("no de série");
        when(resultSet.next()).thenReturn(false);
        when(jdbcTemplate.query(eq("SELECT * FROM incidents"), any(ResultSetExtractor.class)))
                .thenAnswer(invocation -> invocation.<ResultSetExtractor<Void>>getArgument(1).extractData(resultSet));

        SourceTable table = new JdbcSourceTableReader(jdbcTemplate).read("incidents", "SELECT * FROM incidents");

        assertThat(table.size()).isZero();
        assertThat(table.hasColumn("no de série")).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldWrapDataAccessFailures() {
        JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
        when(jdbcTemplate.query(eq("SELECT * FROM installations"), any(ResultSetExtractor.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> new JdbcSourceTableReader(jdbcTemplate).read("installations", "SELECT * FROM installations"))
                .isInstanceOfSatisfying(SourceTableException.class, e -> {
                    assertThat(e.getSource()).isEqualTo("installations");
                    assertThat(e.getMessage()).contains("connection refused");
                    assertThat(e.getCause()).isInstanceOf(DataAccessResourceFailureException.class);
                });
    }
}
