package com.rht.repairorder.load;

import com.rht.repairorder.config.PipelineProperties;
import com.rht.repairorder.entity.IsoTimestampConverter;
import com.rht.repairorder.entity.RepairOrder;
import com.rht.repairorder.entity.RepairOrderDetail;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Statement;
import java.util.Collection;
import java.util.List;

/**
 * Bulk-inserts the merged orders: every header row first, then every detail row.
 * A failure on the header insert aborts before any detail row is attempted.
 */
@Slf4j
@Component
public class OrderLoader {

    private static final String INSERT_ORDER = """
        INSERT INTO repair_order (order_id, timestamp, status, cost, technician)
        VALUES (?, ?, ?, ?, ?)
        """;

    private static final String INSERT_DETAIL = """
        INSERT INTO repair_order_detail (order_id, part_name, quantity)
        VALUES (?, ?, ?)
        """;

    private final JdbcTemplate jdbcTemplate;
    private final int batchSize;

    public OrderLoader(JdbcTemplate jdbcTemplate, PipelineProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.batchSize = Math.max(1, properties.getInsertBatchSize());
    }

    /**
     * @throws OrderLoadException naming the table whose insert failed
     */
    public LoadSummary persist(Collection<RepairOrder> orders) {
        int orderRows = insertOrders(orders);
        log.info("Inserted {} rows into {}.", orderRows, SchemaManager.ORDER_TABLE);

        List<RepairOrderDetail> details = orders.stream()
            .flatMap(order -> order.getDetails().stream())
            .toList();
        int detailRows = insertDetails(details);
        log.info("Inserted {} rows into {}.", detailRows, SchemaManager.DETAIL_TABLE);

        return new LoadSummary(orderRows, detailRows);
    }

    private int insertOrders(Collection<RepairOrder> orders) {
        if (orders.isEmpty()) {
            return 0;
        }
        try {
            int[][] counts = jdbcTemplate.batchUpdate(INSERT_ORDER, orders, batchSize, (ps, order) -> {
                ps.setInt(1, order.getOrderId());
                ps.setString(2, IsoTimestampConverter.FORMAT.format(order.getTimestamp()));
                ps.setString(3, order.getStatus().getLabel());
                ps.setDouble(4, order.getCost());
                ps.setString(5, order.getTechnician());
            });
            return rowCount(counts);
        } catch (DataAccessException e) {
            throw new OrderLoadException(SchemaManager.ORDER_TABLE, e);
        }
    }

    private int insertDetails(List<RepairOrderDetail> details) {
        if (details.isEmpty()) {
            return 0;
        }
        try {
            int[][] counts = jdbcTemplate.batchUpdate(INSERT_DETAIL, details, batchSize, (ps, detail) -> {
                ps.setInt(1, detail.getOrderId());
                ps.setString(2, detail.getPartName());
                ps.setInt(3, detail.getQuantity());
            });
            return rowCount(counts);
        } catch (DataAccessException e) {
            throw new OrderLoadException(SchemaManager.DETAIL_TABLE, e);
        }
    }

    private static int rowCount(int[][] counts) {
        int rows = 0;
        for (int[] batch : counts) {
            for (int count : batch) {
                if (count == Statement.SUCCESS_NO_INFO) {
                    rows++;
                } else {
                    rows += count;
                }
            }
        }
        return rows;
    }
}
