package se.ironyy_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import se.ironyy_be.pojo.OrderStatusUpdate;

import java.util.List;
import java.util.Optional;

@Repository
public interface OrderStatusUpdateRepository extends JpaRepository<OrderStatusUpdate, Long> {

    /**
     * Full trail for an order, newest first. The id breaks ties between rows written
     * within the same clock tick.
     */
    List<OrderStatusUpdate> findByOrderOrderIdOrderByTimestampDescIdDesc(Long orderId);

    Optional<OrderStatusUpdate> findFirstByOrderOrderIdOrderByTimestampDescIdDesc(Long orderId);

    long countByOrderOrderId(Long orderId);
}
