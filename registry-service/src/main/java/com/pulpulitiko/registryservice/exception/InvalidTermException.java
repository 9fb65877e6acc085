package com.pulpulitiko.registryservice.exception;

public class InvalidTermException extends RuntimeException {

    public InvalidTermException(String message) {
        super(message);
    }
}
