package com.rht.repairorder.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of {@link RepairOrderDetail}.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RepairOrderDetailId implements Serializable {

    @Column(name = "order_id")
    private Integer orderId;

    @Column(name = "part_name")
    private String partName;
}
