package com.perpetua.backend.exception;

public class UnknownInstrumentException extends RuntimeException {
    public UnknownInstrumentException(String message) {
        super(message);
    }
}
