package com.abandonflow.analyzer.parser;

/**
 * 上传的文件整体无法读取（不是工作簿、IO 失败等）。单行数据问题不走异常。
 */
public class CallLogReadException extends RuntimeException {

    public CallLogReadException(String message) {
        super(message);
    }

    public CallLogReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
