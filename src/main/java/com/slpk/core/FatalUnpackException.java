package com.slpk.core;

/**
 * 解包线程异常终止（而不是返回失败结果）
 * 此时线程状态未知，整个解包过程不能继续
 */
public class FatalUnpackException extends RuntimeException {
    
    public FatalUnpackException(String message, Throwable cause) {
        super(message, cause);
    }
}
