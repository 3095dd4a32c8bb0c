package com.bucketretry.core.spi;

import com.bucketretry.model.ClassifiedError;
import com.bucketretry.model.HttpResponseMeta;

import java.util.Optional;

/**
 * 失败分类器
 */
public interface ErrorClassifier {

    /**
     * @param response 响应, 可为 null（连接未完成）
     * @param error    失败原因
     * @return 空 = 无法分类, 调用方不重试, 原样抛出
     */
    Optional<ClassifiedError> classify(HttpResponseMeta response, Throwable error);
}
