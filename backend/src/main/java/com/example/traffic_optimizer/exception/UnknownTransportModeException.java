package com.example.traffic_optimizer.exception;

public class UnknownTransportModeException extends RuntimeException {

    public UnknownTransportModeException() {
        super();
    }

    public UnknownTransportModeException(String mode) {
        super("Unknown transport mode. mode=" + mode);
    }

    public UnknownTransportModeException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnknownTransportModeException(Throwable cause) {
        super(cause);
    }

    protected UnknownTransportModeException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
