package br.com.analytics.pipeline.device_lifecycle_batch.config;

import br.com.analytics.pipeline.device_lifecycle_batch.model.MergedRecord;
import br.com.analytics.pipeline.device_lifecycle_batch.processor.DeviceLifecyclePipeline;
import br.com.analytics.pipeline.device_lifecycle_batch.reader.JdbcSourceTableReader;
import br.com.analytics.pipeline.device_lifecycle_batch.reader.SourceTableReader;
import br.com.analytics.pipeline.device_lifecycle_batch.tasklet.LifecycleReconciliationTasklet;
import br.com.analytics.pipeline.device_lifecycle_batch.writer.AggregateBucketWriter;
import br.com.analytics.pipeline.device_lifecycle_batch.writer.MergedRecordCsvWriter;
import br.com.analytics.pipeline.device_lifecycle_batch.writer.MergedRecordWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.support.CompositeItemWriter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;

@Configuration
@EnableBatchProcessing
public class DeviceLifecycleBatchConfig {

    private static final Logger log = LoggerFactory.getLogger(DeviceLifecycleBatchConfig.class);

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;

    public DeviceLifecycleBatchConfig(JobRepository jobRepository,
                                      @Qualifier("batchTransactionManager") PlatformTransactionManager transactionManager) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
    }

    @Bean
    public SourceTableReader sourceTableReader(@Qualifier("appDataSource") DataSource appDataSource) {
        return new JdbcSourceTableReader(appDataSource);
    }

    @Bean
    public MergedRecordWriter mergedRecordWriter(@Qualifier("batchDataSource") DataSource batchDataSource,
                                                 LifecycleProperties properties) {
        return new MergedRecordWriter(batchDataSource, properties.getOutput().getRecordsTable());
    }

    @Bean
    public ItemWriter<MergedRecord> recordOutputWriter(MergedRecordWriter mergedRecordWriter,
                                                       LifecycleProperties properties) {
        Path csv = properties.getOutput().getRecordsCsv();
        if (csv == null) {
            return mergedRecordWriter;
        }
        CompositeItemWriter<MergedRecord> writer = new CompositeItemWriter<>();
        writer.setDelegates(List.of(mergedRecordWriter, new MergedRecordCsvWriter(csv)));
        return writer;
    }

    @Bean
    public AggregateBucketWriter aggregateBucketWriter(@Qualifier("batchDataSource") DataSource batchDataSource,
                                                       LifecycleProperties properties) {
        return new AggregateBucketWriter(batchDataSource, properties.getOutput().getAggregatesTable());
    }

    @Bean
    public LifecycleReconciliationTasklet reconciliationTasklet(SourceTableReader sourceTableReader,
                                                                DeviceLifecyclePipeline pipeline,
                                                                @Qualifier("recordOutputWriter") ItemWriter<MergedRecord> recordOutputWriter,
                                                                AggregateBucketWriter aggregateBucketWriter,
                                                                LifecycleProperties properties) {
        return new LifecycleReconciliationTasklet(
                sourceTableReader, pipeline, recordOutputWriter, aggregateBucketWriter, properties);
    }

    @Bean
    public Step reconciliationStep(LifecycleReconciliationTasklet reconciliationTasklet) {
        return new StepBuilder("reconciliationStep", jobRepository)
                .tasklet(reconciliationTasklet, transactionManager)
                .build();
    }

    @Bean
    public Job deviceLifecycleJob(Step reconciliationStep) {
        return new JobBuilder("deviceLifecycleJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(reconciliationStep)
                .build();
    }

    @Bean
    public ApplicationRunner deviceLifecycleJobRunner(JobOperator jobOperator, Job deviceLifecycleJob) {
        return args -> {
            JobExecution execution = jobOperator.startNextInstance(deviceLifecycleJob);
            log.info("Job {} finished with status {}", deviceLifecycleJob.getName(), execution.getStatus());
        };
    }
}
