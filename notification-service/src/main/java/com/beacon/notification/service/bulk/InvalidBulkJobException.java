package com.beacon.notification.service.bulk;

public class InvalidBulkJobException extends RuntimeException {

    public InvalidBulkJobException(String message) {
        super(message);
    }
}
