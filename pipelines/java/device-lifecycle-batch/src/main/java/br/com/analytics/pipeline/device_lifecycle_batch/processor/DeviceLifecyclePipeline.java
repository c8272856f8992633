package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.config.ColumnResolver;
import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleProperties.AggregationView;
import br.com.analytics.pipeline.device_lifecycle_batch.config.ResolvedColumns;
import br.com.analytics.pipeline.device_lifecycle_batch.model.AggregateBucket;
import br.com.analytics.pipeline.device_lifecycle_batch.model.DeduplicationResult;
import br.com.analytics.pipeline.device_lifecycle_batch.model.DeviceRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.IncidentEvent;
import br.com.analytics.pipeline.device_lifecycle_batch.model.InstalledDevice;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergeResult;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.ReconciliationResult;
import br.com.analytics.pipeline.device_lifecycle_batch.model.RecordDimension;
import br.com.analytics.pipeline.device_lifecycle_batch.model.ReturnEvent;
import br.com.analytics.pipeline.device_lifecycle_batch.model.RunReport;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTable;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTables;
import br.com.analytics.pipeline.device_lifecycle_batch.model.TableRow;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class DeviceLifecyclePipeline {

    private static final Logger log = LoggerFactory.getLogger(DeviceLifecyclePipeline.class);

    private final ColumnResolver columnResolver;
    private final DateNormalizer dateNormalizer;
    private final SerialCodeParser serialCodeParser;
    private final RecordMerger recordMerger;
    private final Deduplicator deduplicator;
    private final MetricsCalculator metricsCalculator;
    private final Aggregator aggregator;
    private final List<RecordDimension> dedupKey;
    private final List<AggregationView> views;

    public DeviceLifecyclePipeline(ColumnResolver columnResolver, DateNormalizer dateNormalizer,
                                   SerialCodeParser serialCodeParser, RecordMerger recordMerger,
                                   Deduplicator deduplicator, MetricsCalculator metricsCalculator,
                                   Aggregator aggregator, List<RecordDimension> dedupKey,
                                   List<AggregationView> views) {
        this.columnResolver = columnResolver;
        this.dateNormalizer = dateNormalizer;
        this.serialCodeParser = serialCodeParser;
        this.recordMerger = recordMerger;
        this.deduplicator = deduplicator;
        this.metricsCalculator = metricsCalculator;
        this.aggregator = aggregator;
        this.dedupKey = List.copyOf(dedupKey);
        this.views = List.copyOf(views);
    }

    public ReconciliationResult run(SourceTables tables) {
        ResolvedColumns columns = columnResolver.resolve(tables);
        Map<String, Integer> invalidDates = new LinkedHashMap<>();

        List<InstalledDevice> installed = readInstallations(tables.installations(), columns.installations(), invalidDates);
        List<IncidentEvent> incidents = readIncidents(tables.incidents(), columns.incidents(), invalidDates);
        List<ReturnEvent> returns = readReturns(tables.returns(), columns.returns(), invalidDates);
        invalidDates.forEach((column, count) -> {
            if (count > 0) {
                log.warn("{} value(s) in date column '{}' matched no pattern and were left empty", count, column);
            }
        });

        MergeResult merged = recordMerger.merge(installed, incidents, returns);
        DeduplicationResult deduplicated = deduplicator.dedupe(merged.records(), dedupKey);
        List<MergedRecord> records = metricsCalculator.computeAll(deduplicated.records());

        Map<String, List<AggregateBucket>> buckets = new LinkedHashMap<>();
        for (AggregationView view : views) {
            Double threshold = view.isCollapseLongTail() ? view.getOtherThreshold() : null;
            buckets.put(view.getName(), aggregator.aggregate(view.getName(), records, view.getDimensions(), threshold));
        }
        AggregateBucket fleet = aggregator.summarize(records);

        RunReport report = new RunReport(
                tables.installations().size(),
                tables.incidents().size(),
                tables.returns().size(),
                invalidDates,
                installed.stream().filter(d -> !d.serialCode().isValid()).count(),
                merged.report(),
                deduplicated.removedCount(),
                deduplicated.duplicatedRowCount(),
                fleet.anomalousTtfCount());

        log.info("Reconciled {} installation rows with {} incident and {} return rows into {} device records "
                        + "({} duplicates removed, {} invalid serials, {} anomalous TTF)",
                report.installationRows(), report.incidentRows(), report.returnRows(), records.size(),
                report.removedDuplicates(), report.invalidSerials(), report.anomalousTtf());
        return new ReconciliationResult(records, buckets, fleet, report);
    }

    private List<InstalledDevice> readInstallations(SourceTable table, ResolvedColumns.Installations columns,
                                                    Map<String, Integer> invalidDates) {
        List<LocalDate> fabrication = dates(table, columns.fabricationDate(), invalidDates);
        List<LocalDate> installation = dates(table, columns.installationDate(), invalidDates);
        List<LocalDate> lastConnection = dates(table, columns.lastConnectionDate(), invalidDates);
        Set<String> mapped = Set.copyOf(columns.mapped());

        List<InstalledDevice> devices = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            TableRow row = table.rows().get(i);
            Map<String, Object> attributes = new LinkedHashMap<>();
            for (String column : table.columns()) {
                if (!mapped.contains(column)) {
                    attributes.put(column, row.get(column));
                }
            }
            String serial = row.text(columns.serial());
            DeviceRecord device = new DeviceRecord(
                    serial,
                    row.text(columns.model()),
                    row.text(columns.subsidiary()),
                    fabrication.get(i),
                    installation.get(i),
                    lastConnection.get(i),
                    attributes);
            devices.add(new InstalledDevice(device, serialCodeParser.parse(serial)));
        }
        return devices;
    }

    private List<IncidentEvent> readIncidents(SourceTable table, ResolvedColumns.Incidents columns,
                                              Map<String, Integer> invalidDates) {
        List<LocalDate> incidentDates = dates(table, columns.incidentDate(), invalidDates);
        List<IncidentEvent> events = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            TableRow row = table.rows().get(i);
            events.add(new IncidentEvent(
                    row.text(columns.serial()),
                    incidentDates.get(i),
                    columns.description() == null ? null : row.text(columns.description())));
        }
        return events;
    }

    private List<ReturnEvent> readReturns(SourceTable table, ResolvedColumns.Returns columns,
                                          Map<String, Integer> invalidDates) {
        List<LocalDate> returnDates = dates(table, columns.returnDate(), invalidDates);
        List<ReturnEvent> events = new ArrayList<>(table.size());
        for (int i = 0; i < table.size(); i++) {
            TableRow row = table.rows().get(i);
            events.add(new ReturnEvent(
                    row.text(columns.serial()),
                    returnDates.get(i),
                    columns.rmaId() == null ? null : row.text(columns.rmaId())));
        }
        return events;
    }

    private List<@Nullable LocalDate> dates(SourceTable table, @Nullable String column, Map<String, Integer> invalidDates) {
        List<Object> cells = new ArrayList<>(table.size());
        for (TableRow row : table.rows()) {
            cells.add(column == null ? null : row.get(column));
        }
        DateNormalizer.NormalizedColumn normalized = dateNormalizer.normalizeColumn(
                column == null ? "" : column, cells);
        if (column != null) {
            invalidDates.merge(table.name() + "." + column, normalized.invalidCount(), Integer::sum);
        }
        return normalized.dates();
    }
}
