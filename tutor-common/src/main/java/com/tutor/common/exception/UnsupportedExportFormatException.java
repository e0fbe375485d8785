package com.tutor.common.exception;

/**
 * 不支持的报告导出格式。
 */
public class UnsupportedExportFormatException extends TutorException {

    public UnsupportedExportFormatException(String format) {
        super("EXPORT_FORMAT", "不支持的导出格式: " + format);
    }
}
