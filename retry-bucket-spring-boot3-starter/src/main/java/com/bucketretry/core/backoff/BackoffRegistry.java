package com.bucketretry.core.backoff;

import com.bucketretry.core.spi.BackoffPolicy;
import com.bucketretry.model.BackoffConfiguration;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 exponential / fixed
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 未知名称回落到 exponential
 */
public class BackoffRegistry {

    private static final String PREFIX_SPI = "spi:";

    private static final String DEFAULT = "exponential";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    public BackoffRegistry(BackoffConfiguration cfg, @Nullable List<BackoffPolicy> discovered) {
        Objects.requireNonNull(cfg, "cfg");
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent(DEFAULT, new ExponentialJitterBackoffPolicy(cfg));
        policies.putIfAbsent("fixed", new FixedBackoffPolicy(cfg));
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略, 支持 spi:{name} 前缀
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get(DEFAULT);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        return policies.getOrDefault(normalize(s), policies.get(DEFAULT));
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }
}
