package se.ironyy_be.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import se.ironyy_be.pojo.Order;

import java.util.Map;
import java.util.Optional;

@Repository
public class OrderRepositoryImpl implements OrderRepositoryCustom {
    @PersistenceContext
    private EntityManager entityManager;

    @Value("${app.workflow.lock-timeout-ms:3000}")
    private long lockTimeoutMs;

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        Order order = entityManager.find(Order.class, orderId, LockModeType.PESSIMISTIC_WRITE,
                Map.of("jakarta.persistence.lock.timeout", lockTimeoutMs));
        return Optional.ofNullable(order);
    }
}
