package com.rht.repairorder.load;

public class SchemaSetupException extends RuntimeException {

    public SchemaSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
