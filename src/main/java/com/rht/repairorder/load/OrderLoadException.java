package com.rht.repairorder.load;

/**
 * Bulk insert into one of the target tables failed.
 */
public class OrderLoadException extends RuntimeException {

    private final String tableName;

    public OrderLoadException(String tableName, Throwable cause) {
        super("Bulk insert into " + tableName + " failed: " + cause.getMessage(), cause);
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
