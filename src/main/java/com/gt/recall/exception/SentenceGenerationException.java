package com.gt.recall.exception;

public class SentenceGenerationException extends RuntimeException {

    public SentenceGenerationException(String errMsg) {
        super(errMsg);
    }

    public SentenceGenerationException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
