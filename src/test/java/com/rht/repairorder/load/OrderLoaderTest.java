package com.rht.repairorder.load;

import com.rht.repairorder.config.PipelineProperties;
import com.rht.repairorder.entity.RepairOrder;
import com.rht.repairorder.entity.RepairOrderDetail;
import com.rht.repairorder.entity.RepairOrderDetailId;
import com.rht.repairorder.entity.RepairStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for OrderLoader.
 * Uses in-memory H2 database for fast testing.
 */
@DisplayName("OrderLoader Unit Tests")
class OrderLoaderTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private OrderLoader orderLoader;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .generateUniqueName(true)
            .build();
        jdbcTemplate = new JdbcTemplate(database);
        new SchemaManager(jdbcTemplate).ensureSchema();

        PipelineProperties properties = new PipelineProperties();
        properties.setInsertBatchSize(2);
        orderLoader = new OrderLoader(jdbcTemplate, properties);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("Should insert every header and detail row across several batches")
    void shouldPersistOrdersAndDetails() {
        // Given
        RepairOrder first = order(104, RepairStatus.COMPLETED);
        first.addDetail("Tire", 2);
        first.addDetail("Brake Fluid", 1);
        RepairOrder second = order(105, RepairStatus.IN_PROGRESS);
        second.addDetail("Oil Filter", 1);
        RepairOrder third = order(106, RepairStatus.RECEIVED);

        // When
        LoadSummary summary = orderLoader.persist(List.of(first, second, third));

        // Then
        assertThat(summary.ordersInserted()).isEqualTo(3);
        assertThat(summary.detailsInserted()).isEqualTo(3);

        Map<String, Object> row = jdbcTemplate.queryForMap(
            "SELECT timestamp, status, cost, technician FROM repair_order WHERE order_id = 105");
        assertThat(row.get("TIMESTAMP")).isEqualTo("2023-08-11T12:00:00");
        assertThat(row.get("STATUS")).isEqualTo("In Progress");
        assertThat(((Number) row.get("COST")).doubleValue()).isEqualTo(110.5);
        assertThat(row.get("TECHNICIAN")).isEqualTo("Robert White");

        assertThat(jdbcTemplate.queryForList(
            "SELECT part_name FROM repair_order_detail WHERE order_id = 104 ORDER BY part_name", String.class))
            .containsExactly("Brake Fluid", "Tire");
    }

    @Test
    @DisplayName("Should do nothing for an empty final state")
    void shouldHandleEmptyState() {
        LoadSummary summary = orderLoader.persist(List.of());

        assertThat(summary).isEqualTo(new LoadSummary(0, 0));
    }

    @Test
    @DisplayName("Should abort before the detail insert when the header insert fails")
    void shouldAbortOnHeaderFailure() {
        // Given
        jdbcTemplate.update(
            "INSERT INTO repair_order (order_id, timestamp, status, cost, technician) VALUES (104, 'x', 'x', 0, 'x')");
        RepairOrder clash = order(104, RepairStatus.COMPLETED);
        clash.addDetail("Tire", 2);

        // When / Then
        assertThatThrownBy(() -> orderLoader.persist(List.of(clash)))
            .isInstanceOf(OrderLoadException.class)
            .extracting(e -> ((OrderLoadException) e).getTableName())
            .isEqualTo(SchemaManager.ORDER_TABLE);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM repair_order_detail", Long.class)).isZero();
    }

    @Test
    @DisplayName("Should name the detail table when the detail insert fails")
    void shouldReportDetailFailure() {
        // Given
        RepairOrder order = order(104, RepairStatus.COMPLETED);
        RepairOrderDetail orphan = RepairOrderDetail.builder()
            .id(new RepairOrderDetailId(999, "Tire"))
            .quantity(1)
            .build();
        order.getDetails().add(orphan);

        // When / Then
        assertThatThrownBy(() -> orderLoader.persist(List.of(order)))
            .isInstanceOf(OrderLoadException.class)
            .hasMessageContaining(SchemaManager.DETAIL_TABLE);
    }

    private static RepairOrder order(int orderId, RepairStatus status) {
        return RepairOrder.builder()
            .orderId(orderId)
            .timestamp(LocalDateTime.of(2023, 8, 11, 12, 0, 0))
            .status(status)
            .cost(110.5)
            .technician("Robert White")
            .build();
    }
}
