package br.com.analytics.pipeline.device_lifecycle_batch.config;

import br.com.analytics.pipeline.device_lifecycle_batch.model.RecordDimension;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.lifecycle")
public class LifecycleProperties {

    @Valid
    @NotNull
    private InstallationSource installations = new InstallationSource();

    @Valid
    @NotNull
    private IncidentSource incidents = new IncidentSource();

    @Valid
    @NotNull
    private ReturnSource returns = new ReturnSource();

    @Valid
    @NotNull
    private Dates dates = new Dates();

    @Valid
    @NotNull
    private Serial serial = new Serial();

    @NotEmpty
    private List<RecordDimension> dedupKey = new ArrayList<>(List.of(RecordDimension.MODEL, RecordDimension.SERIAL));

    private boolean fabricationFromSerial = true;

    @NotNull
    private IncidentBasis ttfIncidentBasis = IncidentBasis.LAST;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private @Nullable LocalDate referenceDate;

    @Valid
    @NotNull
    private List<AggregationView> aggregations = new ArrayList<>();

    @Valid
    @NotNull
    private Output output = new Output();

    public enum IncidentBasis {
        FIRST,
        LAST
    }

    public static class InstallationSource {

        @NotBlank
        private String query = "SELECT * FROM installations";

        @Valid
        @NotNull
        private InstallationColumns columns = new InstallationColumns();

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public InstallationColumns getColumns() {
            return columns;
        }

        public void setColumns(InstallationColumns columns) {
            this.columns = columns;
        }
    }

    public static class InstallationColumns {

        private @Nullable String serial;
        private @Nullable String model;
        private @Nullable String subsidiary;
        private @Nullable String fabricationDate;
        private @Nullable String installationDate;
        private @Nullable String lastConnectionDate;

        public @Nullable String getSerial() {
            return serial;
        }

        public void setSerial(@Nullable String serial) {
            this.serial = serial;
        }

        public @Nullable String getModel() {
            return model;
        }

        public void setModel(@Nullable String model) {
            this.model = model;
        }

        public @Nullable String getSubsidiary() {
            return subsidiary;
        }

        public void setSubsidiary(@Nullable String subsidiary) {
            this.subsidiary = subsidiary;
        }

        public @Nullable String getFabricationDate() {
            return fabricationDate;
        }

        public void setFabricationDate(@Nullable String fabricationDate) {
            this.fabricationDate = fabricationDate;
        }

        public @Nullable String getInstallationDate() {
            return installationDate;
        }

        public void setInstallationDate(@Nullable String installationDate) {
            this.installationDate = installationDate;
        }

        public @Nullable String getLastConnectionDate() {
            return lastConnectionDate;
        }

        public void setLastConnectionDate(@Nullable String lastConnectionDate) {
            this.lastConnectionDate = lastConnectionDate;
        }
    }

    public static class IncidentSource {

        @NotBlank
        private String query = "SELECT * FROM incidents";

        @Valid
        @NotNull
        private IncidentColumns columns = new IncidentColumns();

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public IncidentColumns getColumns() {
            return columns;
        }

        public void setColumns(IncidentColumns columns) {
            this.columns = columns;
        }
    }

    public static class IncidentColumns {

        private @Nullable String serial;
        private @Nullable String incidentDate;
        private @Nullable String description;

        public @Nullable String getSerial() {
            return serial;
        }

        public void setSerial(@Nullable String serial) {
            this.serial = serial;
        }

        public @Nullable String getIncidentDate() {
            return incidentDate;
        }

        public void setIncidentDate(@Nullable String incidentDate) {
            this.incidentDate = incidentDate;
        }

        public @Nullable String getDescription() {
            return description;
        }

        public void setDescription(@Nullable String description) {
            this.description = description;
        }
    }

    public static class ReturnSource {

        @NotBlank
        private String query = "SELECT * FROM returns";

        @Valid
        @NotNull
        private ReturnColumns columns = new ReturnColumns();

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public ReturnColumns getColumns() {
            return columns;
        }

        public void setColumns(ReturnColumns columns) {
            this.columns = columns;
        }
    }

    public static class ReturnColumns {

        private @Nullable String serial;
        private @Nullable String returnDate;
        private @Nullable String rmaId;

        public @Nullable String getSerial() {
            return serial;
        }

        public void setSerial(@Nullable String serial) {
            this.serial = serial;
        }

        public @Nullable String getReturnDate() {
            return returnDate;
        }

        public void setReturnDate(@Nullable String returnDate) {
            this.returnDate = returnDate;
        }

        public @Nullable String getRmaId() {
            return rmaId;
        }

        public void setRmaId(@Nullable String rmaId) {
            this.rmaId = rmaId;
        }
    }

    public static class Dates {

        /**
         * Candidate patterns, tried in order. The first one producing a real calendar date wins,
         * so the position of day-first against month-first patterns decides ambiguous values.
         */
        @NotEmpty
        private List<String> patterns = new ArrayList<>(List.of(
                "yyyy-MM-dd",
                "dd/MM/yyyy",
                "dd-MM-yyyy",
                "MM/dd/yyyy",
                "MM-dd-yyyy",
                "yyyy/MM/dd",
                "dd.MM.yyyy",
                "yyyy.MM.dd",
                "yyyy-MM-dd HH:mm:ss[.SSSSSS]"));

        private boolean spreadsheetSerialDates = true;

        @Min(1)
        @Max(9999)
        private int minYear = 1900;

        @Min(1)
        @Max(9999)
        private int maxYear = 2100;

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            this.patterns = patterns;
        }

        public boolean isSpreadsheetSerialDates() {
            return spreadsheetSerialDates;
        }

        public void setSpreadsheetSerialDates(boolean spreadsheetSerialDates) {
            this.spreadsheetSerialDates = spreadsheetSerialDates;
        }

        public int getMinYear() {
            return minYear;
        }

        public void setMinYear(int minYear) {
            this.minYear = minYear;
        }

        public int getMaxYear() {
            return maxYear;
        }

        public void setMaxYear(int maxYear) {
            this.maxYear = maxYear;
        }
    }

    public static class Serial {

        @Min(4)
        @Max(64)
        private int length = 7;

        @Min(0)
        private int monthOffset = 0;

        @Min(0)
        private int yearOffset = 2;

        @Min(0)
        @Max(99)
        private int minYearCode = 17;

        @Min(0)
        @Max(99)
        private int maxYearCode = 26;

        @Min(0)
        private int centuryBase = 2000;

        public int getLength() {
            return length;
        }

        public void setLength(int length) {
            this.length = length;
        }

        public int getMonthOffset() {
            return monthOffset;
        }

        public void setMonthOffset(int monthOffset) {
            this.monthOffset = monthOffset;
        }

        public int getYearOffset() {
            return yearOffset;
        }

        public void setYearOffset(int yearOffset) {
            this.yearOffset = yearOffset;
        }

        public int getMinYearCode() {
            return minYearCode;
        }

        public void setMinYearCode(int minYearCode) {
            this.minYearCode = minYearCode;
        }

        public int getMaxYearCode() {
            return maxYearCode;
        }

        public void setMaxYearCode(int maxYearCode) {
            this.maxYearCode = maxYearCode;
        }

        public int getCenturyBase() {
            return centuryBase;
        }

        public void setCenturyBase(int centuryBase) {
            this.centuryBase = centuryBase;
        }
    }

    public static class AggregationView {

        @NotBlank
        private String name;

        @NotEmpty
        private List<RecordDimension> dimensions = new ArrayList<>();

        private boolean collapseLongTail = false;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double otherThreshold = 0.02;

        public AggregationView() {
        }

        public AggregationView(String name, List<RecordDimension> dimensions) {
            this.name = name;
            this.dimensions = new ArrayList<>(dimensions);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<RecordDimension> getDimensions() {
            return dimensions;
        }

        public void setDimensions(List<RecordDimension> dimensions) {
            this.dimensions = dimensions;
        }

        public boolean isCollapseLongTail() {
            return collapseLongTail;
        }

        public void setCollapseLongTail(boolean collapseLongTail) {
            this.collapseLongTail = collapseLongTail;
        }

        public double getOtherThreshold() {
            return otherThreshold;
        }

        public void setOtherThreshold(double otherThreshold) {
            this.otherThreshold = otherThreshold;
        }
    }

    public static class Output {

        @NotBlank
        private String recordsTable = "device_lifecycle";

        @NotBlank
        private String aggregatesTable = "device_lifecycle_aggregate";

        private @Nullable Path recordsCsv;

        public String getRecordsTable() {
            return recordsTable;
        }

        public void setRecordsTable(String recordsTable) {
            this.recordsTable = recordsTable;
        }

        public String getAggregatesTable() {
            return aggregatesTable;
        }

        public void setAggregatesTable(String aggregatesTable) {
            this.aggregatesTable = aggregatesTable;
        }

        public @Nullable Path getRecordsCsv() {
            return recordsCsv;
        }

        public void setRecordsCsv(@Nullable Path recordsCsv) {
            this.recordsCsv = recordsCsv;
        }
    }

    public InstallationSource getInstallations() {
        return installations;
    }

    public void setInstallations(InstallationSource installations) {
        this.installations = installations;
    }

    public IncidentSource getIncidents() {
        return incidents;
    }

    public void setIncidents(IncidentSource incidents) {
        this.incidents = incidents;
    }

    public ReturnSource getReturns() {
        return returns;
    }

    public void setReturns(ReturnSource returns) {
        this.returns = returns;
    }

    public Dates getDates() {
        return dates;
    }

    public void setDates(Dates dates) {
        this.dates = dates;
    }

    public Serial getSerial() {
        return serial;
    }

    public void setSerial(Serial serial) {
        this.serial = serial;
    }

    public List<RecordDimension> getDedupKey() {
        return dedupKey;
    }

    public void setDedupKey(List<RecordDimension> dedupKey) {
        this.dedupKey = dedupKey;
    }

    public boolean isFabricationFromSerial() {
        return fabricationFromSerial;
    }

    public void setFabricationFromSerial(boolean fabricationFromSerial) {
        this.fabricationFromSerial = fabricationFromSerial;
    }

    public IncidentBasis getTtfIncidentBasis() {
        return ttfIncidentBasis;
    }

    public void setTtfIncidentBasis(IncidentBasis ttfIncidentBasis) {
        this.ttfIncidentBasis = ttfIncidentBasis;
    }

    public @Nullable LocalDate getReferenceDate() {
        return referenceDate;
    }

    public void setReferenceDate(@Nullable LocalDate referenceDate) {
        this.referenceDate = referenceDate;
    }

    public List<AggregationView> getAggregations() {
        return aggregations;
    }

    public void setAggregations(List<AggregationView> aggregations) {
        this.aggregations = aggregations;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }
}
