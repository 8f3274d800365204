package com.propertyintel.housekeeping.exception;

public class ReportWriteException extends RuntimeException {

    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
