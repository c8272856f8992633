package br.com.analytics.pipeline.device_lifecycle_batch.writer;

import br.com.analytics.pipeline.device_lifecycle_batch.model.AggregateBucket;
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

public class AggregateBucketWriter implements ItemWriter<AggregateBucket> {

    private static final Logger log = LoggerFactory.getLogger(AggregateBucketWriter.class);

    private final NamedParameterJdbcOperations jdbcOperations;
    private final String table;
    private final JdbcBatchItemWriter<AggregateBucket> delegateWriter;

    public AggregateBucketWriter(DataSource dataSource, String table) {
        this(new NamedParameterJdbcTemplate(dataSource), table);
    }

    public AggregateBucketWriter(NamedParameterJdbcOperations jdbcOperations, String table) {
        this.jdbcOperations = jdbcOperations;
        this.table = table;
        this.delegateWriter = UpsertStatements.initialized(new JdbcBatchItemWriterBuilder<AggregateBucket>()
                .itemSqlParameterSourceProvider(item -> new MapSqlParameterSource(item.toRow()))
                .sql(UpsertStatements.upsert(table, AggregateBucket.COLUMNS, List.of("view_name", "group_key")))
                .namedParametersJdbcTemplate(jdbcOperations)
                .build());
    }

    @Override
    public void write(Chunk<? extends AggregateBucket> chunk) throws Exception {
        int removed = jdbcOperations.update(UpsertStatements.deleteAll(table), Map.of());
        log.info("Cleared {} aggregate buckets from the previous run.", removed);
        if (chunk.isEmpty()) {
            log.info("No aggregate buckets to write.");
            return;
        }
        log.info("Writing {} aggregate buckets ...", chunk.size());
        delegateWriter.write(chunk);
    }
}
