package com.example.traffic_optimizer.exception;

public class InvalidModeProfileException extends RuntimeException {

    public InvalidModeProfileException() {
        super();
    }

    public InvalidModeProfileException(String mode, String reason) {
        super("Invalid transport mode profile. mode=" + mode + ", reason=" + reason);
    }

    public InvalidModeProfileException(String message) {
        super(message);
    }


    public InvalidModeProfileException(String message, Throwable cause) {
        super(message, cause);
    }

    public InvalidModeProfileException(Throwable cause) {
        super(cause);
    }

    protected InvalidModeProfileException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
