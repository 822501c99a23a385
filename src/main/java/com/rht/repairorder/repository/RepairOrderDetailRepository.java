package com.rht.repairorder.repository;

import com.rht.repairorder.entity.RepairOrderDetail;
import com.rht.repairorder.entity.RepairOrderDetailId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for RepairOrderDetail entities.
 */
@Repository
public interface RepairOrderDetailRepository extends JpaRepository<RepairOrderDetail, RepairOrderDetailId> {

    /**
     * Parts consumed by one order, ordered by part name
     */
    @Query("SELECT d FROM RepairOrderDetail d WHERE d.id.orderId = :orderId ORDER BY d.id.partName")
    List<RepairOrderDetail> findByOrderId(@Param("orderId") Integer orderId);
}
