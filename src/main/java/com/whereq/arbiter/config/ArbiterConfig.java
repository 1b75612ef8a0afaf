package com.whereq.arbiter.config;

import com.whereq.arbiter.executor.AnalysisExecutor;
import com.whereq.arbiter.executor.DisabledAnalysisExecutor;
import com.whereq.arbiter.metrics.MetricsSink;
import com.whereq.arbiter.metrics.MicrometerMetricsSink;
import com.whereq.arbiter.metrics.NoOpMetricsSink;
import com.whereq.arbiter.metrics.QueueMeterBinder;
import com.whereq.arbiter.model.QueueConfiguration;
import com.whereq.arbiter.resource.ResourceGovernor;
import com.whereq.arbiter.resource.ResourceTelemetry;
import com.whereq.arbiter.resource.SystemResourceTelemetry;
import com.whereq.arbiter.service.AnalysisQueue;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the analysis queue and its collaborators
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ArbiterProperties.class)
public class ArbiterConfig {

    @Bean
    public QueueConfiguration queueConfiguration(ArbiterProperties properties) {
        return properties.toQueueConfiguration();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceTelemetry resourceTelemetry() {
        return new SystemResourceTelemetry();
    }

    @Bean
    public ResourceGovernor resourceGovernor(ResourceTelemetry telemetry, QueueConfiguration configuration) {
        return new ResourceGovernor(telemetry, configuration);
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsSink metricsSink(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("No MeterRegistry available, analysis timings will not be recorded");
            return NoOpMetricsSink.INSTANCE;
        }
        return new MicrometerMetricsSink(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public AnalysisExecutor analysisExecutor() {
        log.warn("No AnalysisExecutor bean defined, every analysis request will fail");
        return new DisabledAnalysisExecutor();
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    public AnalysisQueue analysisQueue(QueueConfiguration configuration, AnalysisExecutor executor,
                                       ResourceGovernor governor, MetricsSink metricsSink, Clock clock) {
        return new AnalysisQueue(configuration, executor, governor, metricsSink, clock);
    }

    @Bean
    public QueueMeterBinder queueMeterBinder(AnalysisQueue queue, ResourceTelemetry telemetry) {
        return new QueueMeterBinder(queue, telemetry);
    }
}
