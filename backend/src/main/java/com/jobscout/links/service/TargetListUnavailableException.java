package com.jobscout.links.service;

public class TargetListUnavailableException extends RuntimeException {

    public TargetListUnavailableException(String message) {
        super(message);
    }

    public TargetListUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
