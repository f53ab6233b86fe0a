package se.ironyy_be.pojo.enums;

public enum Role {
    CUSTOMER,
    PRESS,
    DELIVERY,
    ADMIN
}
