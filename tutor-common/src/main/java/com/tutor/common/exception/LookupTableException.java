package com.tutor.common.exception;

/**
 * 查找表加载异常（词表资源缺失、读取失败等），属于启动期错误。
 */
public class LookupTableException extends TutorException {

    public LookupTableException(String message) {
        super("LOOKUP_ERROR", message);
    }

    public LookupTableException(String message, Throwable cause) {
        super("LOOKUP_ERROR", message, cause);
    }
}
