package com.bucketretry.core.policy;

import com.bucketretry.core.spi.RetryPolicy;
import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.RetryToken;
import com.bucketretry.model.enums.ErrorCategory;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 错误类别在允许集合内
 */
@Getter
@ToString
public class ErrorCategoryPolicy implements RetryPolicy {

    private final Set<ErrorCategory> categories;

    public ErrorCategoryPolicy(Collection<ErrorCategory> categories) {
        this.categories = categories == null || categories.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ErrorCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(categories));
    }

    /** 默认 {TRANSIENT, THROTTLING} */
    public static ErrorCategoryPolicy retryableByDefault() {
        EnumSet<ErrorCategory> set = EnumSet.noneOf(ErrorCategory.class);
        for (ErrorCategory c : ErrorCategory.values()) {
            if (c.isRetryableByDefault()) {
                set.add(c);
            }
        }
        return new ErrorCategoryPolicy(set);
    }

    @Override
    public boolean decide(RetryToken token, ClassifiedError error) {
        return categories.contains(error.getCategory());
    }
}
