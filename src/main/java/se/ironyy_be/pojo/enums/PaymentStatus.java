package se.ironyy_be.pojo.enums;

public enum PaymentStatus {
    PENDING,
    AUTHORIZED,
    PAID,
    PARTIALLY_REFUNDED,
    REFUNDED,
    VOIDED,
    FAILED
}
