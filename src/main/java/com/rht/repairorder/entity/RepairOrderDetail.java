package com.rht.repairorder.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA Entity for the repair_order_detail table.
 * One part consumed by a repair order; keyed by (order_id, part_name).
 */
@Entity
@Table(name = "repair_order_detail")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepairOrderDetail {

    @EmbeddedId
    private RepairOrderDetailId id;

    @MapsId("orderId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private RepairOrder repairOrder;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    public Integer getOrderId() {
        return id == null ? null : id.getOrderId();
    }

    public String getPartName() {
        return id == null ? null : id.getPartName();
    }
}
