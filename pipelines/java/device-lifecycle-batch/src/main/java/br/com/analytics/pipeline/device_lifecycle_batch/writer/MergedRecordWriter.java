package br.com.analytics.pipeline.device_lifecycle_batch.writer;

import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;

public class MergedRecordWriter implements ItemWriter<MergedRecord> {

    private static final Logger log = LoggerFactory.getLogger(MergedRecordWriter.class);

    private final NamedParameterJdbcOperations jdbcOperations;
    private final String table;
    private final JdbcBatchItemWriter<MergedRecord> delegateWriter;

    public MergedRecordWriter(DataSource dataSource, String table) {
        this(new NamedParameterJdbcTemplate(dataSource), table);
    }

    public MergedRecordWriter(NamedParameterJdbcOperations jdbcOperations, String table) {
        this.jdbcOperations = jdbcOperations;
        this.table = table;
        this.delegateWriter = createDelegateWriter(jdbcOperations, table);
    }

    private JdbcBatchItemWriter<MergedRecord> createDelegateWriter(NamedParameterJdbcOperations jdbcOperations, String table) {
        JdbcBatchItemWriter<MergedRecord> writer = new JdbcBatchItemWriterBuilder<MergedRecord>()
                .itemSqlParameterSourceProvider(item -> new MapSqlParameterSource(item.canonicalRow()))
                .sql(UpsertStatements.upsert(table, MergedRecord.COLUMNS, List.of("model", "serial")))
                .namedParametersJdbcTemplate(jdbcOperations)
                .build();
        return UpsertStatements.initialized(writer);
    }

    @Override
    public void write(Chunk<? extends MergedRecord> chunk) throws Exception {
        int removed = jdbcOperations.update(UpsertStatements.deleteAll(table), Map.of());
        log.info("Cleared {} device lifecycle records from the previous run.", removed);
        if (chunk.isEmpty()) {
            log.info("No device records to write.");
            return;
        }
        log.info("Writing {} device lifecycle records ...", chunk.size());
        delegateWriter.write(chunk);
    }
}
