package com.example.monitoring.inference;

public class InsufficientSignalException extends RuntimeException {

    public InsufficientSignalException(String message) {
        super(message);
    }
}
