package com.bucketretry.exception;

import com.bucketretry.model.enums.ErrorCategory;
import lombok.Getter;

/**
 * 重试策略拒绝继续（次数耗尽或错误类别不可重试）
 */
@Getter
public class RetryRejectedException extends RetryStrategyException {

    private final int attempt;
    private final ErrorCategory category;

    public RetryRejectedException(int attempt, ErrorCategory category) {
        super("retry rejected by policy, attempt=" + attempt + ", category=" + category);
        this.attempt = attempt;
        this.category = category;
    }
}
