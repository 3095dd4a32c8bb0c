package com.bucketretry.core.failure;

import com.bucketretry.core.spi.ErrorClassifier;
import com.bucketretry.core.spi.TimeSource;
import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.HttpResponseMeta;
import com.bucketretry.model.enums.ErrorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * 状态码分类：
 * 429 -> THROTTLING; 500/502/503/504 -> TRANSIENT; 其他 5xx -> SERVER; 其余 -> CLIENT
 * Retry-After 支持秒数（可带小数）与 HTTP-date
 */
public class StandardErrorClassifier implements ErrorClassifier {

    private static final Logger log = LoggerFactory.getLogger(StandardErrorClassifier.class);

    public static final String RETRY_AFTER = "Retry-After";

    private static final BigDecimal MAX_SECONDS = BigDecimal.valueOf(Long.MAX_VALUE / 1_000_000_000L);

    private final TimeSource timeSource;

    public StandardErrorClassifier(TimeSource timeSource) {
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    }

    @Override
    public Optional<ClassifiedError> classify(HttpResponseMeta response, Throwable error) {
        if (response == null) {
            return Optional.empty();
        }
        ErrorCategory category = categoryOf(response.getStatus());
        Duration hint = response.header(RETRY_AFTER).flatMap(this::parseRetryAfter).orElse(null);
        return Optional.of(ClassifiedError.of(category, hint));
    }

    public static ErrorCategory categoryOf(int status) {
        if (status == 429) {
            return ErrorCategory.THROTTLING;
        }
        switch (status) {
            case 500, 502, 503, 504:
                return ErrorCategory.TRANSIENT;
            default:
                break;
        }
        if (status >= 500 && status < 600) {
            return ErrorCategory.SERVER;
        }
        return ErrorCategory.CLIENT;
    }

    Optional<Duration> parseRetryAfter(String value) {
        String v = value.trim();
        if (v.isEmpty()) {
            return Optional.empty();
        }
        try {
            BigDecimal seconds = new BigDecimal(v);
            if (seconds.signum() < 0) {
                return Optional.empty();
            }
            long nanos = seconds.min(MAX_SECONDS).movePointRight(9).longValue();
            return Optional.of(Duration.ofNanos(nanos));
        } catch (NumberFormatException notSeconds) {
            // 不是秒数, 再按 HTTP-date 解析
        }
        try {
            Instant at = ZonedDateTime.parse(v, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration d = Duration.between(timeSource.now(), at);
            return Optional.of(d.isNegative() ? Duration.ZERO : d);
        } catch (DateTimeParseException e) {
            log.debug("[Classifier] unparseable Retry-After '{}', ignored", v);
            return Optional.empty();
        }
    }
}
