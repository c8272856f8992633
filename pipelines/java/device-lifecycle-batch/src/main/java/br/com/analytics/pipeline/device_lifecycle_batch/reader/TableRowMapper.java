package br.com.analytics.pipeline.device_lifecycle_batch.reader;

import br.com.analytics.pipeline.device_lifecycle_batch.model.TableRow;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.LinkedHashMap;
import java.util.Map;

public class TableRowMapper implements RowMapper<TableRow> {

    @Override
    public TableRow mapRow(ResultSet resultSet, int rowNum) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        Map<String, Object> cells = new LinkedHashMap<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            cells.put(metaData.getColumnLabel(i), toJavaTime(resultSet.getObject(i)));
        }
        return new TableRow(cells);
    }

    private static Object toJavaTime(Object value) {
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime();
        }
        return value;
    }
}
