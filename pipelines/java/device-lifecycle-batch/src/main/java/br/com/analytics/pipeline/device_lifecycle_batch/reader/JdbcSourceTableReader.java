package br.com.analytics.pipeline.device_lifecycle_batch.reader;

import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTable;
import br.com.analytics.pipeline.device_lifecycle_batch.model.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import javax.sql.DataSource;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;

public class JdbcSourceTableReader implements SourceTableReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcSourceTableReader.class);

    private final JdbcTemplate jdbcTemplate;
    private final TableRowMapper rowMapper = new TableRowMapper();

    public JdbcSourceTableReader(DataSource dataSource) {
        this(new JdbcTemplate(dataSource));
    }

    public JdbcSourceTableReader(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.jdbcTemplate.setFetchSize(1000);
    }

    @Override
    public SourceTable read(String name, String query) {
        try {
            List<String> columns = new ArrayList<>();
            List<TableRow> rows = new ArrayList<>();
            ResultSetExtractor<Void> extractor = resultSet -> {
                if (columns.isEmpty()) {
                    ResultSetMetaData metaData = resultSet.getMetaData();
                    for (int i = 1; i <= metaData.getColumnCount(); i++) {
                        columns.add(metaData.getColumnLabel(i));
                    }
                }
                int rowNum = 0;
                while (resultSet.next()) {
                    rows.add(rowMapper.mapRow(resultSet, rowNum++));
                }
                return null;
            };
            jdbcTemplate.query(query, extractor);
            log.info("Read {} rows from source '{}'", rows.size(), name);
            return new SourceTable(name, columns, rows);
        } catch (DataAccessException e) {
            throw new SourceTableException(name, e.getMostSpecificCause().getMessage(), e);
        }
    }
}
