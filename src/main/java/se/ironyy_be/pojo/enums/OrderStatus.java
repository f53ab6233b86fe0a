package se.ironyy_be.pojo.enums;

import java.util.EnumSet;
import java.util.Set;

public enum OrderStatus {
    // Customer is still building the order.
    DRAFT,

    // Submitted, waiting for confirmation.
    PENDING,

    CONFIRMED,

    // Press staff accepted the order; a pickup is being arranged.
    SCHEDULED_FOR_PICKUP,

    // A delivery partner is on the way to collect the garments.
    OUT_FOR_PICKUP,

    PICKED_UP,

    PROCESSING,

    // Cleaned and pressed, waiting for a delivery partner.
    READY,

    OUT_FOR_DELIVERY,

    COMPLETED,

    CANCELLED,

    REFUNDED,

    FAILED;

    private static final Set<OrderStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, REFUNDED, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * True when this status is a live (non-terminal) stage at or past {@code stage}
     * in the lifecycle, or COMPLETED.
     */
    public boolean hasReached(OrderStatus stage) {
        if (this == CANCELLED || this == REFUNDED || this == FAILED) {
            return false;
        }
        return ordinal() >= stage.ordinal();
    }
}
