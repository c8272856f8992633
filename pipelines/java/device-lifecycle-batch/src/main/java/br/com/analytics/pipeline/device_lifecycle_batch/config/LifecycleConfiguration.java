package br.com.analytics.pipeline.device_lifecycle_batch.config;

import br.com.analytics.pipeline.device_lifecycle_batch.processor.Aggregator;
import br.com.analytics.pipeline.device_lifecycle_batch.processor.DateNormalizer;
import br.com.analytics.pipeline.device_lifecycle_batch.processor.Deduplicator;
import br.com.analytics.pipeline.device_lifecycle_batch.processor.DeviceLifecyclePipeline;
import br.com.analytics.pipeline.device_lifecycle_batch.processor.MetricsCalculator;
import br.com.analytics.pipeline.device_lifecycle_batch.processor.RecordMerger;
import br.com.analytics.pipeline.device_lifecycle_batch.processor.SerialCodeParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration(proxyBeanMethods = false)
public class LifecycleConfiguration {

    @Bean
    public Clock lifecycleClock(LifecycleProperties properties) {
        if (properties.getReferenceDate() != null) {
            ZoneId zone = ZoneId.systemDefault();
            return Clock.fixed(properties.getReferenceDate().atStartOfDay(zone).toInstant(), zone);
        }
        return Clock.systemDefaultZone();
    }

    @Bean
    public DeviceLifecyclePipeline deviceLifecyclePipeline(LifecycleProperties properties, Clock lifecycleClock) {
        return new DeviceLifecyclePipeline(
                new ColumnResolver(properties),
                new DateNormalizer(properties.getDates()),
                new SerialCodeParser(properties.getSerial()),
                new RecordMerger(),
                new Deduplicator(),
                new MetricsCalculator(lifecycleClock, properties.isFabricationFromSerial(), properties.getTtfIncidentBasis()),
                new Aggregator(),
                properties.getDedupKey(),
                properties.getAggregations());
    }
}
