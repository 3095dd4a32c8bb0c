package com.bucketretry.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 保底 Simple, 并合入业务方已有的注册表
 */
public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite;

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        this.composite = new CompositeMeterRegistry();
        this.composite.add(new SimpleMeterRegistry());

        if (discovered == null) {
            return;
        }
        for (MeterRegistry mr : discovered) {
            if (mr instanceof CompositeMeterRegistry nested) {
                nested.getRegistries().forEach(this.composite::add);
            } else {
                this.composite.add(mr);
            }
        }
    }

    public MeterRegistry getRegistry() { return composite; }
}
