package com.social.tipping.exception;

public class InvalidTipException extends TipPipelineException {

    public InvalidTipException(String message) {
        super(message);
    }
}
