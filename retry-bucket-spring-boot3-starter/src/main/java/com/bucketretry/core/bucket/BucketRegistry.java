package com.bucketretry.core.bucket;

import com.bucketretry.config.BucketConfiguration;
import com.bucketretry.config.BucketScope;
import com.bucketretry.config.RetryBucketProperties;
import com.bucketretry.core.metric.RetryMetrics;
import com.bucketretry.core.spi.RetryTokenBucket;
import com.bucketretry.core.spi.Sleeper;
import com.bucketretry.core.spi.TimeSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * partition -> 令牌桶
 * PARTITION: 每个 partition 首次使用时创建, 优先使用 bucket-per-partition 覆盖配置
 * SHARED: 全部 partition 共用一个桶
 */
public class BucketRegistry {

    private static final Logger log = LoggerFactory.getLogger(BucketRegistry.class);

    private static final String SHARED_KEY = "*";

    private final ConcurrentHashMap<String, RetryTokenBucket> buckets = new ConcurrentHashMap<>();

    private final RetryBucketProperties props;

    private final TimeSource timeSource;

    private final Sleeper sleeper;

    private final RetryMetrics meter;

    public BucketRegistry(RetryBucketProperties props, TimeSource timeSource, Sleeper sleeper, RetryMetrics meter) {
        this.props = Objects.requireNonNull(props, "props");
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.meter = meter;
    }

    public RetryTokenBucket bucketFor(String partition) {
        String p = normalize(partition);
        if (props.getBucketScope() == BucketScope.SHARED) {
            return buckets.computeIfAbsent(SHARED_KEY, k -> build(SHARED_KEY, props.getBucket()));
        }
        return buckets.computeIfAbsent(p, k -> build(k, props.bucketFor(k)));
    }

    /** 已创建的桶 */
    public Map<String, RetryTokenBucket> buckets() {
        return Collections.unmodifiableMap(buckets);
    }

    public Set<String> partitions() { return Collections.unmodifiableSet(buckets.keySet()); }

    private RetryTokenBucket build(String key, BucketConfiguration cfg) {
        StandardRetryTokenBucket bucket = new StandardRetryTokenBucket(key, cfg, timeSource, sleeper);
        if (meter != null) {
            meter.registerBucket(key, bucket);
        }
        log.info("[BucketRegistry] bucket created, partition={}, config={}", key, cfg);
        return bucket;
    }

    private String normalize(String partition) {
        if (partition == null || partition.isBlank()) {
            return props.getDefaultPartition();
        }
        return partition.trim();
    }
}
