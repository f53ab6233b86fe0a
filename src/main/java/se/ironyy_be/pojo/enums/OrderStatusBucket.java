package se.ironyy_be.pojo.enums;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Coarse status groups shown on the customer and admin dashboards.
 */
public enum OrderStatusBucket {
    PENDING("pending", EnumSet.of(OrderStatus.PENDING, OrderStatus.CONFIRMED, OrderStatus.SCHEDULED_FOR_PICKUP)),
    IN_PROGRESS("in_progress", EnumSet.of(OrderStatus.OUT_FOR_PICKUP, OrderStatus.PICKED_UP, OrderStatus.PROCESSING)),
    READY("ready", EnumSet.of(OrderStatus.READY, OrderStatus.OUT_FOR_DELIVERY)),
    DONE("done", EnumSet.of(OrderStatus.COMPLETED, OrderStatus.CANCELLED, OrderStatus.REFUNDED));

    private final String param;
    private final Set<OrderStatus> statuses;

    OrderStatusBucket(String param, Set<OrderStatus> statuses) {
        this.param = param;
        this.statuses = statuses;
    }

    public String getParam() {
        return param;
    }

    public Set<OrderStatus> getStatuses() {
        return EnumSet.copyOf(statuses);
    }

    public static Optional<OrderStatusBucket> fromParam(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(bucket -> bucket.param.equalsIgnoreCase(value.trim()) || bucket.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
