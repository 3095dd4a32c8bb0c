package com.bucketretry.config;

/**
 * 令牌桶配置
 * refillRatePerSecond=0 时强制熔断模式（在 setter 中保证, 而非仅在构造时）
 */
public class BucketConfiguration {

    /** 首次尝试扣减 */
    private int initialCost = 0;

    /** 成功后归还 */
    private int initialSuccessIncrement = 1;

    private int maxCapacity = 500;

    /** 非超时类错误的重试扣减 */
    private int standardRetryCost = 5;

    /** TRANSIENT / THROTTLING 的重试扣减 */
    private int timeoutRetryCost = 10;

    /** 每秒回填单位数 */
    private int refillRatePerSecond = 10;

    /** true=容量不足直接失败；false=等待回填 */
    private boolean circuitBreakerMode = true;

    public BucketConfiguration() {
    }

    public BucketConfiguration(BucketConfiguration other) {
        this.initialCost = other.initialCost;
        this.initialSuccessIncrement = other.initialSuccessIncrement;
        this.maxCapacity = other.maxCapacity;
        this.standardRetryCost = other.standardRetryCost;
        this.timeoutRetryCost = other.timeoutRetryCost;
        setRefillRatePerSecond(other.refillRatePerSecond);
        setCircuitBreakerMode(other.circuitBreakerMode);
    }

    /**
     * 参数校验
     */
    public BucketConfiguration validate() {
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("retry.bucket.max-capacity must be > 0");
        }
        if (initialCost < 0 || initialSuccessIncrement < 0 || standardRetryCost < 0
                || timeoutRetryCost < 0 || refillRatePerSecond < 0) {
            throw new IllegalArgumentException("retry.bucket costs and refill rate must be >= 0");
        }
        return this;
    }

    public int getInitialCost() { return initialCost; }
    public void setInitialCost(int initialCost) { this.initialCost = initialCost; }
    public int getInitialSuccessIncrement() { return initialSuccessIncrement; }
    public void setInitialSuccessIncrement(int initialSuccessIncrement) { this.initialSuccessIncrement = initialSuccessIncrement; }
    public int getMaxCapacity() { return maxCapacity; }
    public void setMaxCapacity(int maxCapacity) { this.maxCapacity = maxCapacity; }
    public int getStandardRetryCost() { return standardRetryCost; }
    public void setStandardRetryCost(int standardRetryCost) { this.standardRetryCost = standardRetryCost; }
    public int getTimeoutRetryCost() { return timeoutRetryCost; }
    public void setTimeoutRetryCost(int timeoutRetryCost) { this.timeoutRetryCost = timeoutRetryCost; }
    public int getRefillRatePerSecond() { return refillRatePerSecond; }

    public void setRefillRatePerSecond(int refillRatePerSecond) {
        this.refillRatePerSecond = refillRatePerSecond;
        // 无法回填 只能拒绝
        if (refillRatePerSecond == 0) {
            this.circuitBreakerMode = true;
        }
    }

    public boolean isCircuitBreakerMode() { return circuitBreakerMode; }

    public void setCircuitBreakerMode(boolean circuitBreakerMode) {
        this.circuitBreakerMode = circuitBreakerMode || refillRatePerSecond == 0;
    }

    @Override
    public String toString() {
        return "BucketConfiguration{initialCost=" + initialCost
                + ", initialSuccessIncrement=" + initialSuccessIncrement
                + ", maxCapacity=" + maxCapacity
                + ", standardRetryCost=" + standardRetryCost
                + ", timeoutRetryCost=" + timeoutRetryCost
                + ", refillRatePerSecond=" + refillRatePerSecond
                + ", circuitBreakerMode=" + circuitBreakerMode + '}';
    }
}
