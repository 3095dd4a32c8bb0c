package com.bucketretry.model;

import lombok.Builder;
import lombok.Data;

/**
 * 传给业务操作的本次尝试信息
 */
@Data
@Builder
public class AttemptContext {

    private String partition;
    /** 从 0 开始 */
    private int attempt;
    private int maxAttempts;
}
