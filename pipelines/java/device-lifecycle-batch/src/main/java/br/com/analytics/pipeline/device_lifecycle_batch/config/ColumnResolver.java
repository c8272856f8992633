package br.com.analytics.pipeline.device_lifecycle_batch.config;

import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTable;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTables;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

public class ColumnResolver {

    private final LifecycleProperties properties;

    public ColumnResolver(LifecycleProperties properties) {
        this.properties = properties;
    }

    public ResolvedColumns resolve(SourceTables tables) {
        List<String> missing = new ArrayList<>();

        LifecycleProperties.InstallationColumns inst = properties.getInstallations().getColumns();
        SourceTable installations = tables.installations();
        ResolvedColumns.Installations installationColumns = new ResolvedColumns.Installations(
                required(installations, "installations.serial", inst.getSerial(), missing),
                required(installations, "installations.model", inst.getModel(), missing),
                required(installations, "installations.subsidiary", inst.getSubsidiary(), missing),
                optional(installations, "installations.fabrication-date", inst.getFabricationDate(), missing),
                required(installations, "installations.installation-date", inst.getInstallationDate(), missing),
                optional(installations, "installations.last-connection-date", inst.getLastConnectionDate(), missing));

        LifecycleProperties.IncidentColumns inc = properties.getIncidents().getColumns();
        SourceTable incidents = tables.incidents();
        ResolvedColumns.Incidents incidentColumns = new ResolvedColumns.Incidents(
                required(incidents, "incidents.serial", inc.getSerial(), missing),
                required(incidents, "incidents.incident-date", inc.getIncidentDate(), missing),
                optional(incidents, "incidents.description", inc.getDescription(), missing));

        LifecycleProperties.ReturnColumns ret = properties.getReturns().getColumns();
        SourceTable returns = tables.returns();
        ResolvedColumns.Returns returnColumns = new ResolvedColumns.Returns(
                required(returns, "returns.serial", ret.getSerial(), missing),
                required(returns, "returns.return-date", ret.getReturnDate(), missing),
                optional(returns, "returns.rma-id", ret.getRmaId(), missing));

        if (!missing.isEmpty()) {
            throw new LifecycleConfigurationException(missing);
        }
        return new ResolvedColumns(installationColumns, incidentColumns, returnColumns);
    }

    private static String required(SourceTable table, String field, @Nullable String column, List<String> missing) {
        if (column == null || column.isBlank()) {
            missing.add(field + " (not mapped)");
            return "";
        }
        if (!table.hasColumn(column)) {
            missing.add(field + " -> '" + column + "'");
        }
        return column;
    }

    private static @Nullable String optional(SourceTable table, String field, @Nullable String column, List<String> missing) {
        if (column == null || column.isBlank()) {
            return null;
        }
        if (!table.hasColumn(column)) {
            missing.add(field + " -> '" + column + "'");
        }
        return column;
    }
}
