package com.example.traffic_optimizer.exception;

public class RegionDataException extends RuntimeException {

    public RegionDataException() {
        super();
    }

    public RegionDataException(String message) {
        super(message);
    }


    public RegionDataException(String message, Throwable cause) {
        super(message, cause);
    }

    public RegionDataException(Throwable cause) {
        super(cause);
    }

    protected RegionDataException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
