package se.ironyy_be.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.enums.OrderStatus;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long>, OrderRepositoryCustom {

    Page<Order> findByCustomerUserIdOrderByCreatedAtDesc(Long customerId, Pageable pageable);

    Page<Order> findByCustomerUserIdAndStatusInOrderByCreatedAtDesc(Long customerId, Collection<OrderStatus> statuses, Pageable pageable);

    @Query(value = "SELECT o FROM Order o LEFT JOIN o.assignedStaff s " +
            "WHERE o.status IN :statuses " +
            "AND (:staffId IS NULL OR s IS NULL OR s.userId = :staffId) " +
            "ORDER BY CASE o.status " +
            "WHEN se.ironyy_be.pojo.enums.OrderStatus.CONFIRMED THEN 0 " +
            "WHEN se.ironyy_be.pojo.enums.OrderStatus.PICKED_UP THEN 1 " +
            "WHEN se.ironyy_be.pojo.enums.OrderStatus.PROCESSING THEN 2 " +
            "WHEN se.ironyy_be.pojo.enums.OrderStatus.READY THEN 3 " +
            "ELSE 4 END, o.createdAt ASC",
            countQuery = "SELECT COUNT(o) FROM Order o LEFT JOIN o.assignedStaff s " +
                    "WHERE o.status IN :statuses " +
                    "AND (:staffId IS NULL OR s IS NULL OR s.userId = :staffId)")
    Page<Order> findPressQueue(@Param("statuses") Collection<OrderStatus> statuses,
                               @Param("staffId") Long staffId,
                               Pageable pageable);

    @Query(value = "SELECT o FROM Order o LEFT JOIN o.deliveryPerson d " +
            "WHERE (o.status IN :openStatuses AND (:deliveryId IS NULL OR d IS NULL OR d.userId = :deliveryId)) " +
            "OR (o.status IN :activeStatuses AND (:deliveryId IS NULL OR d.userId = :deliveryId)) " +
            "ORDER BY o.createdAt ASC",
            countQuery = "SELECT COUNT(o) FROM Order o LEFT JOIN o.deliveryPerson d " +
                    "WHERE (o.status IN :openStatuses AND (:deliveryId IS NULL OR d IS NULL OR d.userId = :deliveryId)) " +
                    "OR (o.status IN :activeStatuses AND (:deliveryId IS NULL OR d.userId = :deliveryId))")
    Page<Order> findDeliveryQueue(@Param("openStatuses") Collection<OrderStatus> openStatuses,
                                  @Param("activeStatuses") Collection<OrderStatus> activeStatuses,
                                  @Param("deliveryId") Long deliveryId,
                                  Pageable pageable);

    Page<Order> findAllByOrderByCreatedAtDesc(Pageable pageable);

    @Query("SELECT o.version FROM Order o WHERE o.orderId = :orderId")
    Optional<Long> findVersionById(@Param("orderId") Long orderId);

    long countByStatus(OrderStatus status);

    long countByStatusIn(Collection<OrderStatus> statuses);

    /**
     * One row per press assignee with completed orders: user_id, first_name, last_name, email,
     * completed count and mean minutes from creation to completion. Busiest first.
     */
    @Query(value = """
        SELECT u.user_id, u.first_name, u.last_name, u.email,
               COUNT(o.order_id) AS completed_orders,
               AVG(EXTRACT(EPOCH FROM o.completed_at) - EXTRACT(EPOCH FROM o.created_at)) / 60 AS average_minutes
        FROM orders o
        JOIN users u ON u.user_id = o.assigned_staff_id
        WHERE o.status = 'COMPLETED' AND o.completed_at IS NOT NULL
        GROUP BY u.user_id, u.first_name, u.last_name, u.email
        ORDER BY completed_orders DESC, u.user_id
        LIMIT :limit
        """, nativeQuery = true)
    List<Object[]> findStaffCompletionStats(@Param("limit") int limit);
}
