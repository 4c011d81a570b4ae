package com.slpk;

/**
 * SLPK解包工具自定义异常基类
 * 用于区分可预期的错误（输入错误、文件错误）与程序内部错误
 */
public class SlpkException extends Exception {
    
    public SlpkException(String message) {
        super(message);
    }
    
    public SlpkException(String message, Throwable cause) {
        super(message, cause);
    }
}
