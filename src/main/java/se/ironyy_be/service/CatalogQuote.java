package se.ironyy_be.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Prices for one (service, variant, options) combination as the catalog reports them right now.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogQuote {
    private Long serviceId;
    private Long variantId;
    private String serviceName;
    private String variantName;
    // base price plus the variant adjustment
    private BigDecimal unitPrice;
    @Builder.Default
    private List<OptionQuote> options = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OptionQuote {
        private Long optionId;
        private String name;
        private BigDecimal priceAdjustment;
    }

    public String getDisplayName() {
        return variantName == null ? serviceName : serviceName + " - " + variantName;
    }
}
