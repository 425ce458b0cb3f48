package com.example.traffic_optimizer.exception;

public class RoutingProviderException extends RuntimeException {

    public RoutingProviderException() {
        super();
    }

    public RoutingProviderException(String message) {
        super(message);
    }


    public RoutingProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public RoutingProviderException(Throwable cause) {
        super(cause);
    }

    protected RoutingProviderException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
