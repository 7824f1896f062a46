package com.example.microscopy.decode;

/**
 * 解码失败（外部进程启动失败 / 退出码非 0 / 输出不是合法 JSON / 文件不存在）。
 * 这是整个提取过程里唯一会往外抛的错误，不产生部分结果。
 */
public class DatasetDecodeException extends RuntimeException {

    public DatasetDecodeException(String message) {
        super(message);
    }

    public DatasetDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
