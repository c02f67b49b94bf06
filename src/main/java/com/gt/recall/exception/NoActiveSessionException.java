package com.gt.recall.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown by the serving layer when a user has no review session to operate on
@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class NoActiveSessionException extends RuntimeException {

    public NoActiveSessionException(String msg) {
        super(msg);
    }
}
