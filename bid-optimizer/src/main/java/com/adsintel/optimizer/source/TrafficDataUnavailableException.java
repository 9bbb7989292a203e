package com.adsintel.optimizer.source;

public class TrafficDataUnavailableException extends RuntimeException {

    public TrafficDataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
