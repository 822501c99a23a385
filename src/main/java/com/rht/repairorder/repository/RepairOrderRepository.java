package com.rht.repairorder.repository;

import com.rht.repairorder.entity.RepairOrder;
import com.rht.repairorder.entity.RepairStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for RepairOrder entities.
 * Read side of the loaded store; rows are written in bulk by the loader, not through this interface.
 */
@Repository
public interface RepairOrderRepository extends JpaRepository<RepairOrder, Integer> {

    /**
     * Find an order together with its detail lines
     */
    @Query("SELECT DISTINCT o FROM RepairOrder o LEFT JOIN FETCH o.details WHERE o.orderId = :orderId")
    Optional<RepairOrder> findWithDetails(@Param("orderId") Integer orderId);

    /**
     * Count orders currently in the given status
     */
    long countByStatus(RepairStatus status);
}
