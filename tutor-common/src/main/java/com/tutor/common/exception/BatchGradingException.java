package com.tutor.common.exception;

/**
 * 批量评级异常（调度被中断、结果序列化失败等）。
 */
public class BatchGradingException extends TutorException {

    public BatchGradingException(String message, Throwable cause) {
        super("BATCH_ERROR", message, cause);
    }
}
