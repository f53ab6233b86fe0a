package se.ironyy_be.pojo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderItemOption {

    private Long optionId;

    @Column(length = 100)
    private String name;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal priceAdjustment;
}
