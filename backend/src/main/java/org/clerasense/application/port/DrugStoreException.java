package org.clerasense.application.port;

public class DrugStoreException extends RuntimeException {
    public DrugStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
