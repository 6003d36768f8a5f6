package com.guardframe.api.exception;

/**
 * GuardFrame 基础异常
 *
 * @author GuardFrame
 */
public class GuardException extends RuntimeException {

    public GuardException(String message) {
        super(message);
    }

    public GuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
