package com.bucketretry.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一次 execute 调用的状态
 */
@AllArgsConstructor
@Getter
public enum SequenceState {
    FRESH(false, "尚未获取令牌"),
    ATTEMPTING(false, "执行中"),
    RETRYING(false, "已刷新令牌，等待退避"),
    SUCCEEDED(true, "执行成功，终态"),
    REJECTED(true, "策略或容量拒绝重试，原始异常抛出，终态"),
    UNCLASSIFIED(true, "异常无法分类，直接抛出，终态"),
    CANCELLED(true, "调用方取消，终态")
    ;

    private final boolean terminal;
    private final String desc;
}
