package se.ironyy_be.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import se.ironyy_be.IntegrationTestSupport;
import se.ironyy_be.dto.request.DeliveryUpdateRequest;
import se.ironyy_be.dto.request.DiscountRequest;
import se.ironyy_be.dto.request.OrderCreateRequest;
import se.ironyy_be.dto.request.OrderItemRequest;
import se.ironyy_be.dto.request.OrderItemUpdateRequest;
import se.ironyy_be.dto.response.OrderDetailResponse;
import se.ironyy_be.dto.response.OrderItemResponse;
import se.ironyy_be.exception.BusinessLogicException;
import se.ironyy_be.exception.ResourceNotFoundException;
import se.ironyy_be.exception.UnauthorizedException;
import se.ironyy_be.pojo.LaundryService;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.DeliveryType;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.pojo.enums.Role;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderWorkflowService workflowService;

    private User customer;
    private User otherCustomer;
    private User press;
    private User courier;
    private User admin;
    private LaundryService dryCleaning;
    private Long suitId;
    private Long stainId;
    private Long discontinuedId;

    @BeforeEach
    void setUp() {
        customer = user("customer@test.local", Role.CUSTOMER);
        otherCustomer = user("other@test.local", Role.CUSTOMER);
        press = user("press@test.local", Role.PRESS);
        courier = user("courier@test.local", Role.DELIVERY);
        admin = user("admin@test.local", Role.ADMIN);
        dryCleaning = dryCleaning();
        suitId = dryCleaning.getVariants().get(0).getVariantId();
        stainId = dryCleaning.getOptions().get(0).getOptionId();
        discontinuedId = dryCleaning.getOptions().get(1).getOptionId();
    }

    private OrderItemRequest suits(int quantity) {
        return OrderItemRequest.builder()
                .serviceId(dryCleaning.getServiceId())
                .variantId(suitId)
                .optionIds(List.of(stainId))
                .quantity(quantity)
                .build();
    }

    private OrderDetailResponse draftWithSuits() {
        return orderService.createOrder(OrderCreateRequest.builder()
                .pickupAddress("12 Linen Lane")
                .items(List.of(suits(2)))
                .build(), customer);
    }

    @Test
    void createOrderPricesItemsFromTheCatalog() {
        OrderDetailResponse created = draftWithSuits();

        assertThat(created.getStatus()).isEqualTo(OrderStatus.DRAFT.name());
        assertThat(created.getOrderNumber()).matches("\\d{6}-\\d{5}");
        assertThat(created.getOrderItems()).hasSize(1);
        OrderItemResponse item = created.getOrderItems().get(0);
        assertThat(item.getName()).isEqualTo("Dry Cleaning - Suit");
        assertThat(item.getUnitPrice()).isEqualByComparingTo("30.00");
        assertThat(item.getOptions()).extracting(OrderItemResponse.OptionInfo::getName).containsExactly("Stain treatment");
        assertThat(item.getTotalPrice()).isEqualByComparingTo("65.00");
        assertThat(created.getSubtotal()).isEqualByComparingTo("65.00");
        assertThat(created.getTaxAmount()).isEqualByComparingTo("6.50");
        assertThat(created.getShippingCost()).isEqualByComparingTo("0.00");
        assertThat(created.getTotalAmount()).isEqualByComparingTo("71.50");
        assertThat(created.getAllowedNextStatuses()).containsExactlyInAnyOrder("CONFIRMED", "CANCELLED");
        assertThat(statusUpdateRepository.count()).isZero();
    }

    @Test
    void submittedOrderStartsPendingWithDeliveryFee() {
        OrderDetailResponse created = orderService.createOrder(OrderCreateRequest.builder()
                .deliveryType(DeliveryType.DELIVERY)
                .pickupAddress("12 Linen Lane")
                .deliveryAddress("12 Linen Lane")
                .submit(true)
                .items(List.of(suits(1)))
                .build(), customer);

        assertThat(created.getStatus()).isEqualTo(OrderStatus.PENDING.name());
        assertThat(created.getShippingCost()).isEqualByComparingTo("5.00");
        // 35.00 + 3.50 tax + 5.00 delivery
        assertThat(created.getTotalAmount()).isEqualByComparingTo("43.50");
    }

    @Test
    void createOrderRejectsBadInput() {
        assertThatThrownBy(() -> orderService.createOrder(OrderCreateRequest.builder()
                .deliveryType(DeliveryType.DELIVERY)
                .build(), customer))
                .isInstanceOf(BusinessLogicException.class);

        assertThatThrownBy(() -> orderService.createOrder(OrderCreateRequest.builder()
                .items(List.of(OrderItemRequest.builder()
                        .serviceId(dryCleaning.getServiceId())
                        .optionIds(List.of(discontinuedId))
                        .quantity(1)
                        .build()))
                .build(), customer))
                .isInstanceOf(ResourceNotFoundException.class);

        assertThatThrownBy(() -> orderService.createOrder(new OrderCreateRequest(), press))
                .isInstanceOf(UnauthorizedException.class);

        assertThat(orderRepository.count()).isZero();
    }

    @Test
    void itemEditsRecomputeTotals() {
        OrderDetailResponse created = draftWithSuits();
        Long orderId = created.getOrderId();
        Long suitItemId = created.getOrderItems().get(0).getOrderItemId();

        OrderDetailResponse withShirt = orderService.addItem(orderId, OrderItemRequest.builder()
                .serviceId(dryCleaning.getServiceId())
                .quantity(3)
                .description("white shirts")
                .build(), customer);
        assertThat(withShirt.getOrderItems()).hasSize(2);
        // 65.00 + 3 * 12.00
        assertThat(withShirt.getSubtotal()).isEqualByComparingTo("101.00");
        assertThat(withShirt.getOrderItems()).allSatisfy(item -> assertThat(item.getOrderItemId()).isNotNull());
        assertThat(reload(orderId).getOrderItems()).hasSize(2);

        OrderDetailResponse updated = orderService.updateItem(orderId, suitItemId, OrderItemUpdateRequest.builder()
                .quantity(1)
                .discountAmount(new BigDecimal("10.00"))
                .build(), customer);
        // (30.00 + 5.00 - 10.00) + 36.00
        assertThat(updated.getSubtotal()).isEqualByComparingTo("61.00");
        assertThat(updated.getTotalAmount()).isEqualByComparingTo("67.10");

        OrderDetailResponse removed = orderService.removeItem(orderId, suitItemId, customer);
        assertThat(removed.getOrderItems()).extracting(OrderItemResponse::getName).containsExactly("Dry Cleaning");
        assertThat(removed.getSubtotal()).isEqualByComparingTo("36.00");
        assertThat(removed.getTotalAmount()).isEqualByComparingTo("39.60");

        assertThatThrownBy(() -> orderService.removeItem(orderId, suitItemId, customer))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void itemsAreFrozenOncePickedUp() {
        Long orderId = draftWithSuits().getOrderId();
        workflowService.applyTransition(orderId, OrderStatus.CONFIRMED, customer, null);
        workflowService.applyTransition(orderId, OrderStatus.SCHEDULED_FOR_PICKUP, press, null);
        workflowService.applyTransition(orderId, OrderStatus.OUT_FOR_PICKUP, courier, null);

        assertThatThrownBy(() -> orderService.addItem(orderId, suits(1), customer))
                .isInstanceOf(BusinessLogicException.class);
        assertThatThrownBy(() -> orderService.updateDelivery(orderId, DeliveryUpdateRequest.builder()
                .deliveryType(DeliveryType.PICKUP).build(), customer))
                .isInstanceOf(BusinessLogicException.class);
        assertThat(reload(orderId).getOrderItems()).hasSize(1);
    }

    @Test
    void strangersCannotEditOrView() {
        Long orderId = draftWithSuits().getOrderId();

        assertThatThrownBy(() -> orderService.addItem(orderId, suits(1), otherCustomer))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> orderService.getOrder(orderId, otherCustomer))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> orderService.getStatusHistory(orderId, otherCustomer))
                .isInstanceOf(UnauthorizedException.class);

        assertThat(orderService.getOrder(orderId, admin).getOrderId()).isEqualTo(orderId);
        assertThat(orderService.getOrder(orderId, press).getAllowedNextStatuses()).isEmpty();
    }

    @Test
    void switchingToDeliveryAddsTheFee() {
        Long orderId = draftWithSuits().getOrderId();

        assertThatThrownBy(() -> orderService.updateDelivery(orderId, DeliveryUpdateRequest.builder()
                .deliveryType(DeliveryType.DELIVERY).build(), customer))
                .isInstanceOf(BusinessLogicException.class);

        OrderDetailResponse updated = orderService.updateDelivery(orderId, DeliveryUpdateRequest.builder()
                .deliveryType(DeliveryType.DELIVERY)
                .pickupAddress("12 Linen Lane")
                .deliveryAddress("40 Press Street")
                .build(), customer);

        assertThat(updated.getDeliveryAddress()).isEqualTo("40 Press Street");
        assertThat(updated.getShippingCost()).isEqualByComparingTo("5.00");
        assertThat(updated.getTotalAmount()).isEqualByComparingTo("76.50");
    }

    @Test
    void discountNeverDrivesTotalBelowZero() {
        Long orderId = draftWithSuits().getOrderId();

        assertThatThrownBy(() -> orderService.applyDiscount(orderId,
                new DiscountRequest(new BigDecimal("5.00"), "goodwill"), customer))
                .isInstanceOf(UnauthorizedException.class);

        OrderDetailResponse discounted = orderService.applyDiscount(orderId,
                new DiscountRequest(new BigDecimal("500.00"), "complaint"), admin);

        assertThat(discounted.getDiscountAmount()).isEqualByComparingTo("500.00");
        assertThat(discounted.getTotalAmount()).isEqualByComparingTo("0.00");
    }

    @Test
    void repricePicksUpCatalogChanges() {
        Long orderId = draftWithSuits().getOrderId();
        LaundryService service = laundryServiceRepository.findById(dryCleaning.getServiceId()).orElseThrow();
        service.setBasePrice(new BigDecimal("15.00"));
        laundryServiceRepository.save(service);

        assertThat(reload(orderId).getSubtotal()).isEqualByComparingTo("65.00");

        OrderDetailResponse repriced = orderService.repriceItems(orderId, admin);

        assertThat(repriced.getOrderItems().get(0).getUnitPrice()).isEqualByComparingTo("33.00");
        assertThat(repriced.getSubtotal()).isEqualByComparingTo("71.00");
    }

    @Test
    void repriceIsRefusedOnceProcessingStarted() {
        Long orderId = draftWithSuits().getOrderId();
        workflowService.applyTransition(orderId, OrderStatus.CONFIRMED, customer, null);
        workflowService.applyTransition(orderId, OrderStatus.SCHEDULED_FOR_PICKUP, press, null);
        workflowService.applyTransition(orderId, OrderStatus.OUT_FOR_PICKUP, courier, null);
        workflowService.applyTransition(orderId, OrderStatus.PICKED_UP, courier, null);
        workflowService.applyTransition(orderId, OrderStatus.PROCESSING, press, null);

        LaundryService service = laundryServiceRepository.findById(dryCleaning.getServiceId()).orElseThrow();
        service.setBasePrice(new BigDecimal("15.00"));
        laundryServiceRepository.save(service);

        assertThatThrownBy(() -> orderService.repriceItems(orderId, admin))
                .isInstanceOf(BusinessLogicException.class);

        Order order = reload(orderId);
        assertThat(order.getStatus()).isEqualTo(OrderStatus.PROCESSING);
        assertThat(order.getOrderItems()).singleElement()
                .satisfies(item -> assertThat(item.getUnitPrice()).isEqualByComparingTo("30.00"));
        assertThat(order.getSubtotal()).isEqualByComparingTo("65.00");
    }

    @Test
    void assignmentsRespectRoleAndStage() {
        Long orderId = draftWithSuits().getOrderId();

        assertThatThrownBy(() -> orderService.assignStaff(orderId, press.getUserId(), admin))
                .isInstanceOf(BusinessLogicException.class);

        workflowService.applyTransition(orderId, OrderStatus.CONFIRMED, customer, null);
        assertThatThrownBy(() -> orderService.assignStaff(orderId, courier.getUserId(), admin))
                .isInstanceOf(BusinessLogicException.class);
        assertThatThrownBy(() -> orderService.assignDeliveryPerson(orderId, courier.getUserId(), admin))
                .isInstanceOf(BusinessLogicException.class);
        assertThatThrownBy(() -> orderService.assignStaff(orderId, press.getUserId(), press))
                .isInstanceOf(UnauthorizedException.class);

        OrderDetailResponse staffed = orderService.assignStaff(orderId, press.getUserId(), admin);
        assertThat(staffed.getAssignedStaff().getUserId()).isEqualTo(press.getUserId());

        workflowService.applyTransition(orderId, OrderStatus.SCHEDULED_FOR_PICKUP, press, null);
        OrderDetailResponse dispatched = orderService.assignDeliveryPerson(orderId, courier.getUserId(), admin);
        assertThat(dispatched.getDeliveryPerson().getUserId()).isEqualTo(courier.getUserId());
    }

    @Test
    void onlyDraftsCanBeDeleted() {
        Long draftId = draftWithSuits().getOrderId();
        Long pendingId = order(customer, OrderStatus.PENDING).getOrderId();

        assertThatThrownBy(() -> orderService.deleteDraft(draftId, otherCustomer))
                .isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> orderService.deleteDraft(pendingId, customer))
                .isInstanceOf(BusinessLogicException.class);

        orderService.deleteDraft(draftId, customer);

        assertThat(orderRepository.findById(draftId)).isEmpty();
        assertThat(orderRepository.findById(pendingId)).isPresent();
    }

    @Test
    void historyIsNewestFirst() {
        Long orderId = draftWithSuits().getOrderId();
        workflowService.applyTransition(orderId, OrderStatus.CONFIRMED, customer, "first");
        workflowService.applyTransition(orderId, OrderStatus.CANCELLED, customer, "second");

        assertThat(orderService.getStatusHistory(orderId, customer))
                .extracting("toStatus")
                .containsExactly("CANCELLED", "CONFIRMED");
    }
}
