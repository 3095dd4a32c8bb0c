package com.bucketretry.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 响应元数据：状态码 + 头（头名大小写不敏感）
 */
@Getter
@ToString
public final class HttpResponseMeta {

    private final int status;

    private final Map<String, List<String>> headers;

    private HttpResponseMeta(int status, Map<String, List<String>> headers) {
        this.status = status;
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, List.copyOf(v));
                }
            });
        }
        this.headers = Collections.unmodifiableMap(copy);
    }

    public static HttpResponseMeta of(int status) {
        return new HttpResponseMeta(status, Map.of());
    }

    public static HttpResponseMeta of(int status, Map<String, List<String>> headers) {
        return new HttpResponseMeta(status, headers);
    }

    /** 取首个值 */
    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }
}
