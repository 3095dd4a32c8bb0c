package com.bucketretry.exception;

import com.bucketretry.model.HttpResponseMeta;

import java.util.Optional;

/**
 * HTTP 形态的操作失败，可被分类
 * response 为空表示连接未完成
 */
public class HttpOperationException extends RuntimeException {

    private final HttpResponseMeta response;

    public HttpOperationException(HttpResponseMeta response) {
        this(response, null);
    }

    public HttpOperationException(HttpResponseMeta response, Throwable cause) {
        super(response == null ? "http operation failed without response"
                : "http operation failed, status=" + response.getStatus(), cause);
        this.response = response;
    }

    public static HttpOperationException withoutResponse(Throwable cause) {
        return new HttpOperationException(null, cause);
    }

    public Optional<HttpResponseMeta> response() {
        return Optional.ofNullable(response);
    }
}
