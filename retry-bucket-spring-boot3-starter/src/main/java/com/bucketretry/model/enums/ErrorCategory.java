package com.bucketretry.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 失败分类
 */
@AllArgsConstructor
@Getter
public enum ErrorCategory {
    TRANSIENT(true, "瞬时故障（500/502/503/504），默认可重试"),
    THROTTLING(true, "服务端限流（429），默认可重试"),
    SERVER(false, "其他 5xx 服务端错误，默认不重试"),
    CLIENT(false, "客户端错误，默认不重试")
    ;

    private final boolean retryableByDefault;
    private final String desc;

    /** 超时类错误按 timeoutRetryCost 计费 */
    public boolean isTimeoutLike() {
        return this == TRANSIENT || this == THROTTLING;
    }
}
