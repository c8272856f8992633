package br.com.analytics.pipeline.device_lifecycle_batch.tasklet;

import br.com.analytics.pipeline.device_lifecycle_batch.config.LifecycleProperties;
import br.com.analytics.pipeline.device_lifecycle_batch.model.AggregateBucket;
import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.model.ReconciliationResult;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTable;
import br.com.analytics.pipeline.device_lifecycle_batch.model.SourceTables;
import br.com.analytics.pipeline.device_lifecycle_batch.processor.DeviceLifecyclePipeline;
import br.com.analytics.pipeline.device_lifecycle_batch.reader.SourceTableReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.util.ArrayList;
import java.util.List;

public class LifecycleReconciliationTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(LifecycleReconciliationTasklet.class);

    private final SourceTableReader reader;
    private final DeviceLifecyclePipeline pipeline;
    private final ItemWriter<MergedRecord> recordWriter;
    private final ItemWriter<AggregateBucket> bucketWriter;
    private final LifecycleProperties properties;

    public LifecycleReconciliationTasklet(SourceTableReader reader,
                                          DeviceLifecyclePipeline pipeline,
                                          ItemWriter<MergedRecord> recordWriter,
                                          ItemWriter<AggregateBucket> bucketWriter,
                                          LifecycleProperties properties) {
        this.reader = reader;
        this.pipeline = pipeline;
        this.recordWriter = recordWriter;
        this.bucketWriter = bucketWriter;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        SourceTable installations = reader.read("installations", properties.getInstallations().getQuery());
        SourceTable incidents = reader.read("incidents", properties.getIncidents().getQuery());
        SourceTable returns = reader.read("returns", properties.getReturns().getQuery());

        ReconciliationResult result = pipeline.run(new SourceTables(installations, incidents, returns));

        List<AggregateBucket> buckets = new ArrayList<>(result.allBuckets());
        buckets.add(result.fleet());

        recordWriter.write(new Chunk<>(result.records()));
        bucketWriter.write(new Chunk<>(buckets));

        AggregateBucket fleet = result.fleet();
        log.info("Fleet: {} devices, {} with incidents, {} returned, mean TTF {} days, {} invalid dates",
                fleet.count(), fleet.devicesWithIncident(), fleet.devicesReturned(),
                fleet.isTtfDefined() ? String.format("%.1f", fleet.meanTtfDays()) : "undefined",
                result.report().totalInvalidDates());
        return RepeatStatus.FINISHED;
    }
}
