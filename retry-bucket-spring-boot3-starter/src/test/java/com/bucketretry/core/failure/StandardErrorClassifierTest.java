package com.bucketretry.core.failure;

import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.HttpResponseMeta;
import com.bucketretry.model.enums.ErrorCategory;
import com.bucketretry.support.VirtualTimeSource;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StandardErrorClassifierTest {

    private final VirtualTimeSource time = new VirtualTimeSource();

    private final StandardErrorClassifier classifier = new StandardErrorClassifier(time);

    private ClassifiedError classify(int status, String retryAfter) {
        HttpResponseMeta response = retryAfter == null
                ? HttpResponseMeta.of(status)
                : HttpResponseMeta.of(status, Map.of("retry-after", List.of(retryAfter)));
        return classifier.classify(response, new RuntimeException("boom")).orElseThrow();
    }

    @Test
    void mapsStatusCodes() {
        assertEquals(ErrorCategory.THROTTLING, StandardErrorClassifier.categoryOf(429));
        for (int status : new int[]{500, 502, 503, 504}) {
            assertEquals(ErrorCategory.TRANSIENT, StandardErrorClassifier.categoryOf(status));
        }
        assertEquals(ErrorCategory.SERVER, StandardErrorClassifier.categoryOf(501));
        assertEquals(ErrorCategory.SERVER, StandardErrorClassifier.categoryOf(599));
        assertEquals(ErrorCategory.CLIENT, StandardErrorClassifier.categoryOf(400));
        assertEquals(ErrorCategory.CLIENT, StandardErrorClassifier.categoryOf(404));
        assertEquals(ErrorCategory.CLIENT, StandardErrorClassifier.categoryOf(302));
    }

    @Test
    void noResponseIsUnclassified() {
        assertEquals(Optional.empty(), classifier.classify(null, new RuntimeException("reset")));
    }

    @Test
    void readsRetryAfterSecondsCaseInsensitively() {
        ClassifiedError e = classify(429, "2");
        assertEquals(ErrorCategory.THROTTLING, e.getCategory());
        assertEquals(Optional.of(Duration.ofSeconds(2)), e.retryAfterHint());

        assertEquals(Optional.of(Duration.ofMillis(1500)), classify(503, "1.5").retryAfterHint());
    }

    @Test
    void readsRetryAfterHttpDate() {
        // 2024-01-01T00:00:30Z
        ClassifiedError e = classify(503, "Mon, 1 Jan 2024 00:00:30 GMT");
        assertEquals(Optional.of(Duration.ofSeconds(30)), e.retryAfterHint());
    }

    @Test
    void pastHttpDateMeansNoWait() {
        ClassifiedError e = classify(503, "Sun, 31 Dec 2023 23:59:00 GMT");
        assertEquals(Optional.of(Duration.ZERO), e.retryAfterHint());
    }

    @Test
    void ignoresMalformedRetryAfter() {
        assertEquals(Optional.empty(), classify(503, "soon").retryAfterHint());
        assertEquals(Optional.empty(), classify(503, "-3").retryAfterHint());
        assertEquals(Optional.empty(), classify(503, "").retryAfterHint());
        assertEquals(Optional.empty(), classify(503, null).retryAfterHint());
    }
}
