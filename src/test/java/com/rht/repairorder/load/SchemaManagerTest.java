package com.rht.repairorder.load;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SchemaManager.
 * Uses in-memory H2 database for fast testing.
 */
@DisplayName("SchemaManager Unit Tests")
class SchemaManagerTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private SchemaManager schemaManager;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .generateUniqueName(true)
            .build();
        jdbcTemplate = new JdbcTemplate(database);
        schemaManager = new SchemaManager(jdbcTemplate);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("Should create both tables")
    void shouldCreateTables() {
        // When
        schemaManager.ensureSchema();

        // Then
        assertThat(schemaManager.tableExists(SchemaManager.ORDER_TABLE)).isTrue();
        assertThat(schemaManager.tableExists(SchemaManager.DETAIL_TABLE)).isTrue();
    }

    @Test
    @DisplayName("Should be safe to call repeatedly without touching existing rows")
    void shouldBeIdempotent() {
        // Given
        schemaManager.ensureSchema();
        insertOrderWithPart(104, "Tire");

        // When / Then
        assertThatCode(() -> {
            schemaManager.ensureSchema();
            schemaManager.ensureSchema();
        }).doesNotThrowAnyException();
        assertThat(count("repair_order")).isEqualTo(1);
        assertThat(count("repair_order_detail")).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM information_schema.tables WHERE LOWER(table_name) LIKE 'repair_order%'",
            Long.class)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should empty both tables without violating the foreign key")
    void shouldResetTables() {
        // Given
        schemaManager.ensureSchema();
        insertOrderWithPart(104, "Tire");
        insertOrderWithPart(105, "Brake Fluid");

        // When
        schemaManager.reset();

        // Then
        assertThat(count("repair_order")).isZero();
        assertThat(count("repair_order_detail")).isZero();
    }

    @Test
    @DisplayName("Should enforce the detail-to-order foreign key")
    void shouldEnforceForeignKey() {
        // Given
        schemaManager.ensureSchema();
        insertOrderWithPart(104, "Tire");

        // When / Then
        assertThatThrownBy(() -> jdbcTemplate.update("DELETE FROM repair_order"))
            .isInstanceOf(DataIntegrityViolationException.class);
        assertThatThrownBy(() -> jdbcTemplate.update(
            "INSERT INTO repair_order_detail (order_id, part_name, quantity) VALUES (999, 'Tire', 1)"))
            .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Should report a reset failure as a schema error")
    void shouldFailResetWithoutTables() {
        assertThatThrownBy(() -> schemaManager.reset())
            .isInstanceOf(SchemaSetupException.class)
            .hasMessageContaining(SchemaManager.DETAIL_TABLE);
    }

    private void insertOrderWithPart(int orderId, String partName) {
        jdbcTemplate.update(
            "INSERT INTO repair_order (order_id, timestamp, status, cost, technician) VALUES (?, ?, ?, ?, ?)",
            orderId, "2023-08-11T12:00:00", "Completed", 110.0, "Robert White");
        jdbcTemplate.update(
            "INSERT INTO repair_order_detail (order_id, part_name, quantity) VALUES (?, ?, ?)",
            orderId, partName, 1);
    }

    private long count(String table) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
    }
}
