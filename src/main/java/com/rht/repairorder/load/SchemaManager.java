package com.rht.repairorder.load;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the repair_order / repair_order_detail tables and empties them before a full reload.
 */
@Slf4j
@Component
public class SchemaManager {

    public static final String ORDER_TABLE = "repair_order";
    public static final String DETAIL_TABLE = "repair_order_detail";

    private static final String CREATE_ORDER_TABLE = """
        CREATE TABLE IF NOT EXISTS repair_order (
            order_id   INTEGER PRIMARY KEY,
            timestamp  VARCHAR,
            status     VARCHAR,
            cost       DOUBLE PRECISION,
            technician VARCHAR
        )
        """;

    private static final String CREATE_DETAIL_TABLE = """
        CREATE TABLE IF NOT EXISTS repair_order_detail (
            order_id   INTEGER NOT NULL,
            part_name  VARCHAR NOT NULL,
            quantity   INTEGER,
            PRIMARY KEY (order_id, part_name),
            FOREIGN KEY (order_id) REFERENCES repair_order (order_id)
        )
        """;

    private static final String TABLE_EXISTS = """
        SELECT COUNT(*) FROM information_schema.tables
        WHERE LOWER(table_name) = ? AND LOWER(table_schema) = LOWER(CURRENT_SCHEMA)
        """;

    private final JdbcTemplate jdbcTemplate;

    public SchemaManager(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Create both tables if absent. Safe to call repeatedly.
     *
     * @throws SchemaSetupException if a table cannot be created
     */
    public void ensureSchema() {
        // Parent first: the detail table's foreign key needs repair_order.
        createIfAbsent(ORDER_TABLE, CREATE_ORDER_TABLE);
        createIfAbsent(DETAIL_TABLE, CREATE_DETAIL_TABLE);
    }

    /**
     * Delete every row, child table first so the foreign key holds throughout.
     *
     * @throws SchemaSetupException if a table cannot be emptied
     */
    public void reset() {
        for (String table : new String[] {DETAIL_TABLE, ORDER_TABLE}) {
            try {
                int deleted = jdbcTemplate.update("DELETE FROM " + table);
                log.info("Deleted {} rows from {}.", deleted, table);
            } catch (DataAccessException e) {
                throw new SchemaSetupException("Cannot reset table " + table, e);
            }
        }
    }

    public boolean tableExists(String tableName) {
        Long count = jdbcTemplate.queryForObject(TABLE_EXISTS, Long.class, tableName.toLowerCase());
        return count != null && count > 0;
    }

    private void createIfAbsent(String tableName, String ddl) {
        try {
            if (tableExists(tableName)) {
                log.info("Table {} already present.", tableName);
                return;
            }
            log.debug("Executing: {}", ddl);
            jdbcTemplate.execute(ddl);
            log.info("Created table {}.", tableName);
        } catch (DataAccessException e) {
            throw new SchemaSetupException("Cannot create table " + tableName, e);
        }
    }
}
