package se.ironyy_be.pojo;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import se.ironyy_be.pojo.enums.DeliveryType;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.pojo.enums.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "orders")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long orderId;

    @Column(nullable = false, unique = true, length = 20, updatable = false)
    private String orderNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id", nullable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User customer;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private OrderStatus status = OrderStatus.DRAFT;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    @Builder.Default
    private DeliveryType deliveryType = DeliveryType.PICKUP;

    @Column(columnDefinition = "text")
    private String pickupAddress;

    @Column(columnDefinition = "text")
    private String deliveryAddress;

    private LocalDate preferredPickupDate;
    private LocalDate preferredDeliveryDate;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal taxAmount = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal shippingCost = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal discountAmount = BigDecimal.ZERO;

    @Column(nullable = false, precision = 10, scale = 2)
    @Builder.Default
    private BigDecimal totalAmount = BigDecimal.ZERO;

    // Press user currently responsible for the order.
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_staff_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User assignedStaff;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "delivery_person_id")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private User deliveryPerson;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    private LocalDateTime confirmedAt;
    private LocalDateTime scheduledForPickupAt;
    private LocalDateTime outForPickupAt;
    private LocalDateTime pickedUpAt;
    private LocalDateTime processingStartedAt;
    private LocalDateTime readyAt;
    private LocalDateTime outForDeliveryAt;
    private LocalDateTime completedAt;
    private LocalDateTime cancelledAt;

    @Column(columnDefinition = "text")
    private String specialInstructions;

    @Column(columnDefinition = "text")
    private String internalNotes;

    @Column(columnDefinition = "text")
    private String cancellationReason;

    @Version
    private Long version;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<OrderItem> orderItems = new ArrayList<>();

    public void addItem(OrderItem item) {
        item.setOrder(this);
        orderItems.add(item);
    }

    public void removeItem(OrderItem item) {
        orderItems.remove(item);
        item.setOrder(null);
    }

    /**
     * Sets the lifecycle timestamp that belongs to {@code reached}, unless it is already set.
     * Returns true when a timestamp was written.
     */
    public boolean stampLifecycle(OrderStatus reached, LocalDateTime at) {
        switch (reached) {
            case CONFIRMED -> {
                if (confirmedAt != null) return false;
                confirmedAt = at;
            }
            case SCHEDULED_FOR_PICKUP -> {
                if (scheduledForPickupAt != null) return false;
                scheduledForPickupAt = at;
            }
            case OUT_FOR_PICKUP -> {
                if (outForPickupAt != null) return false;
                outForPickupAt = at;
            }
            case PICKED_UP -> {
                if (pickedUpAt != null) return false;
                pickedUpAt = at;
            }
            case PROCESSING -> {
                if (processingStartedAt != null) return false;
                processingStartedAt = at;
            }
            case READY -> {
                if (readyAt != null) return false;
                readyAt = at;
            }
            case OUT_FOR_DELIVERY -> {
                if (outForDeliveryAt != null) return false;
                outForDeliveryAt = at;
            }
            case COMPLETED -> {
                if (completedAt != null) return false;
                completedAt = at;
            }
            case CANCELLED -> {
                if (cancelledAt != null) return false;
                cancelledAt = at;
            }
            default -> {
                return false;
            }
        }
        return true;
    }
}
