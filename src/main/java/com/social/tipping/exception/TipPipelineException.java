package com.social.tipping.exception;

/**
 * Base type for failures raised by the tip pipeline itself.
 */
public class TipPipelineException extends RuntimeException {

    public TipPipelineException(String message) {
        super(message);
    }

    public TipPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
