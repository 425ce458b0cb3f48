package com.example.traffic_optimizer.exception;

public class CityNotFoundException extends RuntimeException {

    public CityNotFoundException() {
        super();
    }

    public CityNotFoundException(String cityName) {
        super("City profile not found. city=" + cityName);
    }

    public CityNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public CityNotFoundException(Throwable cause) {
        super(cause);
    }

    protected CityNotFoundException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
