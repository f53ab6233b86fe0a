package se.ironyy_be.mapper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import se.ironyy_be.dto.response.OrderDetailResponse;
import se.ironyy_be.dto.response.OrderItemResponse;
import se.ironyy_be.dto.response.OrderListResponse;
import se.ironyy_be.dto.response.StatusUpdateResponse;
import se.ironyy_be.dto.response.UserSummary;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.OrderItem;
import se.ironyy_be.pojo.OrderStatusUpdate;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mapper class for converting order domain objects to response DTOs. Expects the relations it
 * reads to be loaded already.
 */
@Component
@Slf4j
public class OrderMapper {

    public OrderDetailResponse convertToDetailResponse(Order order, Collection<OrderStatus> allowedNextStatuses) {
        if (order == null) {
            log.warn("Order is null when converting to detail response");
            return null;
        }

        List<OrderItemResponse> items = order.getOrderItems().stream()
                .map(this::convertToItemResponse)
                .collect(Collectors.toList());

        return OrderDetailResponse.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .status(order.getStatus().name())
                .paymentStatus(order.getPaymentStatus().name())
                .deliveryType(order.getDeliveryType().name())
                .version(order.getVersion())
                .pickupAddress(order.getPickupAddress())
                .deliveryAddress(order.getDeliveryAddress())
                .preferredPickupDate(order.getPreferredPickupDate())
                .preferredDeliveryDate(order.getPreferredDeliveryDate())
                .subtotal(order.getSubtotal())
                .taxAmount(order.getTaxAmount())
                .shippingCost(order.getShippingCost())
                .discountAmount(order.getDiscountAmount())
                .totalAmount(order.getTotalAmount())
                .customer(convertToUserSummary(order.getCustomer()))
                .assignedStaff(convertToUserSummary(order.getAssignedStaff()))
                .deliveryPerson(convertToUserSummary(order.getDeliveryPerson()))
                .specialInstructions(order.getSpecialInstructions())
                .cancellationReason(order.getCancellationReason())
                .timeline(convertToTimeline(order))
                .orderItems(items)
                .allowedNextStatuses(allowedNextStatuses == null ? null : allowedNextStatuses.stream()
                        .map(OrderStatus::name)
                        .sorted()
                        .collect(Collectors.toList()))
                .build();
    }

    public OrderListResponse convertToListResponse(Order order) {
        return OrderListResponse.builder()
                .orderId(order.getOrderId())
                .orderNumber(order.getOrderNumber())
                .status(order.getStatus().name())
                .deliveryType(order.getDeliveryType().name())
                .totalAmount(order.getTotalAmount())
                .totalItems(order.getOrderItems().size())
                .createdAt(order.getCreatedAt())
                .customerName(displayName(order.getCustomer()))
                .assignedStaffName(displayName(order.getAssignedStaff()))
                .deliveryPersonName(displayName(order.getDeliveryPerson()))
                .build();
    }

    public OrderItemResponse convertToItemResponse(OrderItem item) {
        return OrderItemResponse.builder()
                .orderItemId(item.getOrderItemId())
                .serviceId(item.getServiceId())
                .variantId(item.getVariantId())
                .name(item.getName())
                .description(item.getDescription())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .discountAmount(item.getDiscountAmount())
                .totalPrice(item.getTotalPrice())
                .options(item.getOptions().stream()
                        .map(option -> OrderItemResponse.OptionInfo.builder()
                                .optionId(option.getOptionId())
                                .name(option.getName())
                                .priceAdjustment(option.getPriceAdjustment())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }

    public StatusUpdateResponse convertToStatusUpdateResponse(OrderStatusUpdate update) {
        User changedBy = update.getChangedBy();
        return StatusUpdateResponse.builder()
                .id(update.getId())
                .fromStatus(update.getFromStatus().name())
                .toStatus(update.getToStatus().name())
                .changedById(changedBy != null ? changedBy.getUserId() : null)
                .changedByName(displayName(changedBy))
                .timestamp(update.getTimestamp())
                .notes(update.getNotes())
                .build();
    }

    public UserSummary convertToUserSummary(User user) {
        if (user == null) {
            return null;
        }
        return UserSummary.builder()
                .userId(user.getUserId())
                .email(user.getEmail())
                .displayName(user.getDisplayName())
                .role(user.getRole().name())
                .build();
    }

    private OrderDetailResponse.Timeline convertToTimeline(Order order) {
        return OrderDetailResponse.Timeline.builder()
                .createdAt(order.getCreatedAt())
                .confirmedAt(order.getConfirmedAt())
                .scheduledForPickupAt(order.getScheduledForPickupAt())
                .outForPickupAt(order.getOutForPickupAt())
                .pickedUpAt(order.getPickedUpAt())
                .processingStartedAt(order.getProcessingStartedAt())
                .readyAt(order.getReadyAt())
                .outForDeliveryAt(order.getOutForDeliveryAt())
                .completedAt(order.getCompletedAt())
                .cancelledAt(order.getCancelledAt())
                .build();
    }

    private String displayName(User user) {
        return user != null ? user.getDisplayName() : null;
    }
}
