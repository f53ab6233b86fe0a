package se.ironyy_be.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderDetailResponse {
    private Long orderId;
    private String orderNumber;
    private String status;
    private String paymentStatus;
    private String deliveryType;
    private Long version;

    private String pickupAddress;
    private String deliveryAddress;
    private LocalDate preferredPickupDate;
    private LocalDate preferredDeliveryDate;

    private BigDecimal subtotal;
    private BigDecimal taxAmount;
    private BigDecimal shippingCost;
    private BigDecimal discountAmount;
    private BigDecimal totalAmount;

    private UserSummary customer;
    private UserSummary assignedStaff;
    private UserSummary deliveryPerson;

    private String specialInstructions;
    private String cancellationReason;

    private Timeline timeline;
    private List<OrderItemResponse> orderItems;

    // Statuses the viewer may request next.
    private List<String> allowedNextStatuses;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Timeline {
        private LocalDateTime createdAt;
        private LocalDateTime confirmedAt;
        private LocalDateTime scheduledForPickupAt;
        private LocalDateTime outForPickupAt;
        private LocalDateTime pickedUpAt;
        private LocalDateTime processingStartedAt;
        private LocalDateTime readyAt;
        private LocalDateTime outForDeliveryAt;
        private LocalDateTime completedAt;
        private LocalDateTime cancelledAt;
    }
}
