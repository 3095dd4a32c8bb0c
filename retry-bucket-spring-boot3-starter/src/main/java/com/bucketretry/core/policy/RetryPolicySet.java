package com.bucketretry.core.policy;

import com.bucketretry.core.spi.RetryPolicy;
import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.RetryToken;
import com.bucketretry.model.enums.ErrorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 重试判定集合
 * <ul>
 *   <li>limits: 全部通过才可能重试（硬上限, 标准集合中为 {@link MaxAttemptsPolicy}）</li>
 *   <li>policies: 逻辑 OR, 任意一条通过即授权重试</li>
 * </ul>
 * policies 的顺序不影响结果：每条判定无副作用, 遇到第一条通过即返回只是省掉后续计算。
 * 不要改成 AND, 也不要在判定里做计数之类的副作用。
 */
public class RetryPolicySet {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicySet.class);

    private final List<RetryPolicy> limits;

    private final List<RetryPolicy> policies;

    public RetryPolicySet(List<? extends RetryPolicy> limits, List<? extends RetryPolicy> policies) {
        this.limits = List.copyOf(limits == null ? List.of() : limits);
        this.policies = List.copyOf(policies == null ? List.of() : policies);
    }

    /**
     * 标准集合：attempt < maxAttempts 且 类别 ∈ retryable
     */
    public static RetryPolicySet standard(int maxAttempts, Collection<ErrorCategory> retryable) {
        return new RetryPolicySet(List.of(new MaxAttemptsPolicy(maxAttempts)),
                List.of(new ErrorCategoryPolicy(retryable)));
    }

    /**
     * 追加 OR 判定, 返回新集合
     */
    public RetryPolicySet or(List<? extends RetryPolicy> extra) {
        List<RetryPolicy> merged = new ArrayList<>(policies);
        merged.addAll(extra);
        return new RetryPolicySet(limits, merged);
    }

    public boolean shouldRetry(RetryToken token, ClassifiedError error) {
        for (RetryPolicy limit : limits) {
            if (!limit.decide(token, error)) {
                log.debug("[RetryPolicy] limit {} declined, attempt={}, category={}",
                        limit.getClass().getSimpleName(), token.getAttempt(), error.getCategory());
                return false;
            }
        }
        for (RetryPolicy policy : policies) {
            if (policy.decide(token, error)) {
                log.debug("[RetryPolicy] {} approved, attempt={}, category={}",
                        policy.getClass().getSimpleName(), token.getAttempt(), error.getCategory());
                return true;
            }
        }
        return false;
    }

    public List<RetryPolicy> getLimits() { return limits; }

    public List<RetryPolicy> getPolicies() { return policies; }

    /** limits 中最严格（最小）的次数上限, 没有则为 Integer.MAX_VALUE */
    public int maxAttempts() {
        return limits.stream()
                .filter(MaxAttemptsPolicy.class::isInstance)
                .mapToInt(p -> ((MaxAttemptsPolicy) p).getMaxAttempts())
                .min()
                .orElse(Integer.MAX_VALUE);
    }
}
