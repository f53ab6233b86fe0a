package se.ironyy_be.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.ironyy_be.pojo.enums.DeliveryType;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryUpdateRequest {

    @NotNull(message = "Delivery type is required")
    private DeliveryType deliveryType;

    @Size(max = 1000)
    private String pickupAddress;

    @Size(max = 1000)
    private String deliveryAddress;

    private LocalDate preferredPickupDate;
    private LocalDate preferredDeliveryDate;
}
