package org.clerasense.application.port;

public class DuplicateDrugException extends RuntimeException {
    private final String genericName;

    public DuplicateDrugException(String genericName, Throwable cause) {
        super("Drug already stored: " + genericName, cause);
        this.genericName = genericName;
    }

    public String genericName() {
        return genericName;
    }
}
