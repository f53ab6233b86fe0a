package se.ironyy_be.pojo.enums;

public enum DeliveryType {
    // Customer drops off and collects at the shop.
    PICKUP,

    // Garments are returned to the delivery address.
    DELIVERY
}
