package com.streetsignal.domain.exception;

public class NoActiveJobException extends RuntimeException {

    public NoActiveJobException() {
        super("No active job");
    }
}
