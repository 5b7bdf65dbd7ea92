package com.perpetua.backend.exception;

public class CycleInProgressException extends RuntimeException {
    public CycleInProgressException(String message) {
        super(message);
    }
}
