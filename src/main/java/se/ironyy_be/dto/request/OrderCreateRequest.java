package se.ironyy_be.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.ironyy_be.pojo.enums.DeliveryType;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderCreateRequest {

    @NotNull(message = "Delivery type is required")
    @Builder.Default
    private DeliveryType deliveryType = DeliveryType.PICKUP;

    @Size(max = 1000, message = "Pickup address cannot exceed 1000 characters")
    private String pickupAddress;

    @Size(max = 1000, message = "Delivery address cannot exceed 1000 characters")
    private String deliveryAddress;

    private LocalDate preferredPickupDate;
    private LocalDate preferredDeliveryDate;

    @Size(max = 2000, message = "Special instructions cannot exceed 2000 characters")
    private String specialInstructions;

    // false keeps the order as a DRAFT, true submits it as PENDING
    private boolean submit;

    @Valid
    @Builder.Default
    private List<OrderItemRequest> items = new ArrayList<>();
}
