package com.streetsignal.domain.exception;

public class InvalidJobSpecException extends RuntimeException {

    public InvalidJobSpecException(String message) {
        super(message);
    }
}
