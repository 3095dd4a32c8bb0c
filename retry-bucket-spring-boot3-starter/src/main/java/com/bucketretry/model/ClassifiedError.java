package com.bucketretry.model;

import com.bucketretry.model.enums.ErrorCategory;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

@Getter
@ToString
@EqualsAndHashCode
public final class ClassifiedError {

    private final ErrorCategory category;

    /** 服务端建议的重试间隔（Retry-After） */
    @Getter(AccessLevel.NONE)
    private final Duration retryAfterHint;

    private ClassifiedError(ErrorCategory category, Duration retryAfterHint) {
        this.category = Objects.requireNonNull(category, "category");
        this.retryAfterHint = retryAfterHint;
    }

    public static ClassifiedError of(ErrorCategory category) {
        return new ClassifiedError(category, null);
    }

    public static ClassifiedError of(ErrorCategory category, Duration retryAfterHint) {
        return new ClassifiedError(category, retryAfterHint);
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfterHint);
    }
}
