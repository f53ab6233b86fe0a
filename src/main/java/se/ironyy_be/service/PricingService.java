package se.ironyy_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.OrderItem;
import se.ironyy_be.pojo.OrderItemOption;
import se.ironyy_be.pojo.enums.DeliveryType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Line-item and order totals. All amounts are rounded to cents, half up, and never negative.
 */
@Service
@Slf4j
public class PricingService {

    private static final int SCALE = 2;

    private final BigDecimal taxRate;
    private final BigDecimal deliveryFee;

    public PricingService(@Value("${app.pricing.tax-rate:0.10}") BigDecimal taxRate,
                          @Value("${app.pricing.delivery-fee:5.00}") BigDecimal deliveryFee) {
        if (taxRate.signum() < 0 || deliveryFee.signum() < 0) {
            throw new IllegalArgumentException("Tax rate and delivery fee must not be negative");
        }
        this.taxRate = taxRate;
        this.deliveryFee = deliveryFee;
    }

    /**
     * unit price * quantity + option adjustments - discount, floored at zero.
     */
    public BigDecimal calculateItemTotal(OrderItem item) {
        BigDecimal gross = nz(item.getUnitPrice()).multiply(BigDecimal.valueOf(item.getQuantity()));
        BigDecimal adjustments = item.getOptions().stream()
                .map(OrderItemOption::getPriceAdjustment)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal total = gross.add(adjustments).subtract(nz(item.getDiscountAmount()));
        return money(total.max(BigDecimal.ZERO));
    }

    /**
     * Recomputes every item total and the order's subtotal, tax, shipping and total in place.
     */
    public void recalculateTotals(Order order) {
        BigDecimal subtotal = BigDecimal.ZERO;
        for (OrderItem item : order.getOrderItems()) {
            item.setTotalPrice(calculateItemTotal(item));
            subtotal = subtotal.add(item.getTotalPrice());
        }
        BigDecimal tax = subtotal.multiply(taxRate);
        BigDecimal shipping = shippingFor(order.getDeliveryType());
        BigDecimal total = subtotal.add(tax).add(shipping).subtract(nz(order.getDiscountAmount()));

        order.setSubtotal(money(subtotal));
        order.setTaxAmount(money(tax));
        order.setShippingCost(money(shipping));
        order.setTotalAmount(money(total.max(BigDecimal.ZERO)));
        log.debug("Order {} totals: subtotal={} tax={} shipping={} discount={} total={}",
                order.getOrderId(), order.getSubtotal(), order.getTaxAmount(), order.getShippingCost(),
                order.getDiscountAmount(), order.getTotalAmount());
    }

    /**
     * Recomputes totals only when the stored figures no longer match the items.
     * Returns true when anything was rewritten.
     */
    public boolean refreshTotalsIfStale(Order order) {
        BigDecimal subtotal = BigDecimal.ZERO;
        boolean stale = false;
        for (OrderItem item : order.getOrderItems()) {
            BigDecimal expected = calculateItemTotal(item);
            stale |= !sameAmount(expected, item.getTotalPrice());
            subtotal = subtotal.add(expected);
        }
        BigDecimal expectedTotal = subtotal.add(subtotal.multiply(taxRate))
                .add(shippingFor(order.getDeliveryType()))
                .subtract(nz(order.getDiscountAmount()))
                .max(BigDecimal.ZERO);
        stale |= !sameAmount(subtotal, order.getSubtotal())
                || !sameAmount(shippingFor(order.getDeliveryType()), order.getShippingCost())
                || !sameAmount(expectedTotal, order.getTotalAmount());

        if (stale) {
            log.debug("Totals for order {} are stale, recalculating", order.getOrderId());
            recalculateTotals(order);
        }
        return stale;
    }

    public BigDecimal shippingFor(DeliveryType deliveryType) {
        return deliveryType == DeliveryType.DELIVERY ? money(deliveryFee) : money(BigDecimal.ZERO);
    }

    private static boolean sameAmount(BigDecimal expected, BigDecimal actual) {
        return actual != null && money(expected).compareTo(actual) == 0;
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
