package com.rht.repairorder.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA Entity for the repair_order table.
 * Represents the current header state of one repair job, keyed by its business order id.
 */
@Entity
@Table(name = "repair_order")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepairOrder {

    @Id
    @Column(name = "order_id")
    private Integer orderId;

    @Column(name = "timestamp")
    @Convert(converter = IsoTimestampConverter.class)
    private LocalDateTime timestamp;

    @Column(name = "status")
    @Convert(converter = RepairStatusConverter.class)
    private RepairStatus status;

    @Column(name = "cost")
    private Double cost;

    @Column(name = "technician")
    private String technician;

    @OneToMany(mappedBy = "repairOrder", cascade = CascadeType.ALL, orphanRemoval = true)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<RepairOrderDetail> details = new ArrayList<>();

    /**
     * Helper method to add a consumed part to this order
     */
    public RepairOrderDetail addDetail(String partName, int quantity) {
        RepairOrderDetail detail = RepairOrderDetail.builder()
            .id(new RepairOrderDetailId(orderId, partName))
            .quantity(quantity)
            .build();
        details.add(detail);
        detail.setRepairOrder(this);
        return detail;
    }
}
