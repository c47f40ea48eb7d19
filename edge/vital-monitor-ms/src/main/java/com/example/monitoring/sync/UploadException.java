package com.example.monitoring.sync;

public class UploadException extends Exception {

    public UploadException(String message) {
        super(message);
    }

    public UploadException(String message, Throwable cause) {
        super(message, cause);
    }
}
