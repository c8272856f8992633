package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.model.IncidentEvent;
import br.com.analytics.pipeline.device_lifecycle_batch.model.IncidentSummary;
import br.com.analytics.pipeline.device_lifecycle_batch.model.InstalledDevice;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergeReport;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergeResult;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.ReturnEvent;
import br.com.analytics.pipeline.device_lifecycle_batch.model.ReturnSummary;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Left-joins incident and return history onto installed devices.
 * <p>
 * Both histories are collapsed to one summary per serial before the join, so a device with many
 * incidents still yields exactly one merged row and the output always has as many rows as the
 * installation input. The "latest" row of a serial is the one with the greatest date; dated rows
 * rank above undated ones and ties go to the row that comes later in the input.
 */
public class RecordMerger {

    public MergeResult merge(List<InstalledDevice> installations, List<IncidentEvent> incidents, List<ReturnEvent> returns) {
        Map<String, IncidentSummary> incidentSummaries = summarizeIncidents(incidents);
        Map<String, ReturnSummary> returnSummaries = summarizeReturns(returns);

        List<MergedRecord> merged = new ArrayList<>(installations.size());
        Set<String> installedSerials = new HashSet<>();
        for (InstalledDevice installed : installations) {
            String key = SerialCodeParser.normalize(installed.device().serial());
            if (key != null) {
                installedSerials.add(key);
            }
            merged.add(new MergedRecord(
                    installed.device(),
                    installed.serialCode(),
                    key == null ? IncidentSummary.NONE : incidentSummaries.getOrDefault(key, IncidentSummary.NONE),
                    key == null ? ReturnSummary.NONE : returnSummaries.getOrDefault(key, ReturnSummary.NONE),
                    null));
        }

        MergeReport report = new MergeReport(
                (int) incidents.stream().filter(e -> SerialCodeParser.normalize(e.serial()) == null).count(),
                (int) returns.stream().filter(e -> SerialCodeParser.normalize(e.serial()) == null).count(),
                (int) incidentSummaries.keySet().stream().filter(s -> !installedSerials.contains(s)).count(),
                (int) returnSummaries.keySet().stream().filter(s -> !installedSerials.contains(s)).count(),
                (int) incidentSummaries.values().stream().filter(s -> s.incidentCount() > 1).count(),
                (int) returnSummaries.values().stream().filter(s -> s.returnCount() > 1).count());
        return new MergeResult(merged, report);
    }

    public Map<String, IncidentSummary> summarizeIncidents(List<IncidentEvent> incidents) {
        Map<String, IncidentSummary> summaries = new LinkedHashMap<>();
        for (IncidentEvent event : incidents) {
            String key = SerialCodeParser.normalize(event.serial());
            if (key == null) {
                continue;
            }
            IncidentSummary current = summaries.get(key);
            if (current == null) {
                summaries.put(key, new IncidentSummary(1, event.incidentDate(), event.incidentDate(), event.description()));
                continue;
            }
            boolean latest = isLater(event.incidentDate(), current.lastIncidentDate());
            summaries.put(key, new IncidentSummary(
                    current.incidentCount() + 1,
                    earliest(current.firstIncidentDate(), event.incidentDate()),
                    latest ? event.incidentDate() : current.lastIncidentDate(),
                    latest ? event.description() : current.lastIncidentDescription()));
        }
        return summaries;
    }

    public Map<String, ReturnSummary> summarizeReturns(List<ReturnEvent> returns) {
        Map<String, ReturnSummary> summaries = new LinkedHashMap<>();
        for (ReturnEvent event : returns) {
            String key = SerialCodeParser.normalize(event.serial());
            if (key == null) {
                continue;
            }
            ReturnSummary current = summaries.get(key);
            if (current == null) {
                summaries.put(key, new ReturnSummary(1, event.returnDate(), event.rmaId()));
                continue;
            }
            boolean latest = isLater(event.returnDate(), current.lastReturnDate());
            summaries.put(key, new ReturnSummary(
                    current.returnCount() + 1,
                    latest ? event.returnDate() : current.lastReturnDate(),
                    latest ? event.rmaId() : current.lastReturnId()));
        }
        return summaries;
    }

    private static boolean isLater(@Nullable LocalDate candidate, @Nullable LocalDate current) {
        if (candidate == null) {
            return current == null;
        }
        return current == null || !candidate.isBefore(current);
    }

    private static @Nullable LocalDate earliest(@Nullable LocalDate a, @Nullable LocalDate b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.isAfter(b) ? b : a;
    }
}
