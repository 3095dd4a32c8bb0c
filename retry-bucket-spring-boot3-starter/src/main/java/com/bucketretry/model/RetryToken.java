package com.bucketretry.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * 一次尝试对桶容量的占用凭证，不可变
 * 每次获取/刷新都会生成新令牌
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RetryToken {

    private final String partition;

    /** 从 0 开始, 每次刷新 +1 */
    private final int attempt;

    /** 成功时归还的容量, 为空视为 0 */
    @Getter(AccessLevel.NONE)
    private final Integer cost;

    public RetryToken(String partition, int attempt, Integer cost) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        this.partition = partition;
        this.attempt = attempt;
        this.cost = cost;
    }

    public Optional<Integer> cost() {
        return Optional.ofNullable(cost);
    }

    public RetryToken next(int cost) {
        return new RetryToken(partition, attempt + 1, cost);
    }
}
