package com.shuking.ojjudge.exception;

/**
 * 沙箱自身的故障，与用户代码无关，最终归类为 IE
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message) {
        super(message);
    }

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
