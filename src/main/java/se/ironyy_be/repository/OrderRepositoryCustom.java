package se.ironyy_be.repository;

import se.ironyy_be.pojo.Order;

import java.util.Optional;

public interface OrderRepositoryCustom {

    /**
     * Loads the order row under a pessimistic write lock, waiting at most the configured
     * lock timeout. Every transition and item edit goes through this, so changes to one
     * order are serialized.
     */
    Optional<Order> findByIdForUpdate(Long orderId);
}
