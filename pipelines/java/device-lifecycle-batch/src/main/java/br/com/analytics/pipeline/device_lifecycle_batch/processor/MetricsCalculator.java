package br.com.analytics.pipeline.device_lifecycle_batch.processor;

import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleProperties.IncidentBasis;
import br.com.analytics.pipeline.device_lifecycle_batch.model.DeviceRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.LifecycleMetrics;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.TtfReference;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Derives reliability metrics relative to an injected clock.
 * <p>
 * Time-to-failure runs from the installation date, or from the fabrication date when the device
 * has no installation date, to the incident date. It exists only for devices with a dated incident.
 * A negative value means the incident predates the reference date; it is kept and flagged.
 */
public class MetricsCalculator {

    private final Clock clock;
    private final boolean fabricationFromSerial;
    private final IncidentBasis incidentBasis;

    public MetricsCalculator(Clock clock, boolean fabricationFromSerial, IncidentBasis incidentBasis) {
        this.clock = clock;
        this.fabricationFromSerial = fabricationFromSerial;
        this.incidentBasis = incidentBasis;
    }

    public List<MergedRecord> computeAll(List<MergedRecord> records) {
        return records.stream().map(this::computeMetrics).toList();
    }

    public MergedRecord computeMetrics(MergedRecord record) {
        return computeMetrics(record, clock);
    }

    public MergedRecord computeMetrics(MergedRecord record, Clock referenceClock) {
        LocalDate today = LocalDate.now(referenceClock);
        MergedRecord withFabrication = fillFabricationDate(record);
        DeviceRecord device = withFabrication.device();

        LocalDate incidentDate = incidentBasis == IncidentBasis.FIRST
                ? withFabrication.incidents().firstIncidentDate()
                : withFabrication.incidents().lastIncidentDate();

        TtfReference reference = null;
        LocalDate referenceDate = null;
        if (device.installationDate() != null) {
            reference = TtfReference.INSTALLATION;
            referenceDate = device.installationDate();
        } else if (device.fabricationDate() != null) {
            reference = TtfReference.FABRICATION;
            referenceDate = device.fabricationDate();
        }

        Long ttf = null;
        if (incidentDate != null && referenceDate != null) {
            ttf = days(referenceDate, incidentDate);
        } else {
            reference = null;
        }

        LifecycleMetrics metrics = new LifecycleMetrics(
                ttf,
                reference,
                ttf != null && ttf < 0,
                days(device.installationDate(), today),
                days(device.fabricationDate(), today),
                days(device.fabricationDate(), device.installationDate()),
                days(device.lastConnectionDate(), today),
                withFabrication.incidents().incidentCount() > 0 && withFabrication.returns().returnCount() == 0);
        return withFabrication.withMetrics(metrics);
    }

    private MergedRecord fillFabricationDate(MergedRecord record) {
        if (!fabricationFromSerial
                || record.device().fabricationDate() != null
                || record.serialCode().derivedFabricationDate() == null) {
            return record;
        }
        return record.withDevice(record.device().withFabricationDate(record.serialCode().derivedFabricationDate()));
    }

    private static @Nullable Long days(@Nullable LocalDate from, @Nullable LocalDate to) {
        if (from == null || to == null) {
            return null;
        }
        return ChronoUnit.DAYS.between(from, to);
    }
}
