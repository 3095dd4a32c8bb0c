package com.bucketretry.autoconfig;

import com.bucketretry.core.metric.RetryMeterRegistryProvider;
import com.bucketretry.core.metric.RetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
public class RetryBucketMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryMeterRegistryProvider retryMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new RetryMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(RetryMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }
}
