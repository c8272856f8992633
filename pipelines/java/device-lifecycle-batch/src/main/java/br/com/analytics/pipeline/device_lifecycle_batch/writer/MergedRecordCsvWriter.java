package br.com.analytics.pipeline.device_lifecycle_batch.writer;

import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.file.FlatFileItemWriter;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.core.io.FileSystemResource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exports merged records to a CSV file in {@link MergedRecord#toRow()} layout, passthrough
 * installation columns and suffixed derived columns included. Each chunk replaces the file.
 */
public class MergedRecordCsvWriter implements ItemWriter<MergedRecord> {

    private static final Logger log = LoggerFactory.getLogger(MergedRecordCsvWriter.class);

    private final Path file;

    public MergedRecordCsvWriter(Path file) {
        this.file = file;
    }

    @Override
    public void write(Chunk<? extends MergedRecord> chunk) throws Exception {
        List<Map<String, Object>> rows = chunk.getItems().stream().map(MergedRecord::toRow).toList();
        List<String> header = header(rows);
        FlatFileItemWriter<Map<String, Object>> delegateWriter = createDelegateWriter(header);
        delegateWriter.open(new ExecutionContext());
        try {
            delegateWriter.write(new Chunk<>(rows));
        } finally {
            delegateWriter.close();
        }
        log.info("Exported {} device lifecycle records to {}", rows.size(), file);
    }

    private FlatFileItemWriter<Map<String, Object>> createDelegateWriter(List<String> header) {
        return new FlatFileItemWriterBuilder<Map<String, Object>>()
                .name("mergedRecordCsvWriter")
                .resource(new FileSystemResource(file))
                .headerCallback(writer -> writer.write(line(header)))
                .lineAggregator(row -> line(header.stream().map(row::get).toList()))
                .saveState(false)
                .build();
    }

    private static List<String> header(List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return MergedRecord.COLUMNS;
        }
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(row -> columns.addAll(row.keySet()));
        return new ArrayList<>(columns);
    }

    static String line(List<?> values) {
        return values.stream().map(MergedRecordCsvWriter::cell).collect(Collectors.joining(","));
    }

    private static String cell(Object value) {
        if (value == null) {
            return "";
        }
        String text = value.toString();
        if (text.contains(",") || text.contains("\"") || text.contains("\n") || text.contains("\r")) {
            return "\"" + text.replace("\"", "\"\"") + "\"";
        }
        return text;
    }
}
