package se.ironyy_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import se.ironyy_be.dto.request.DeliveryUpdateRequest;
import se.ironyy_be.dto.request.DiscountRequest;
import se.ironyy_be.dto.request.OrderCreateRequest;
import se.ironyy_be.dto.request.OrderItemRequest;
import se.ironyy_be.dto.request.OrderItemUpdateRequest;
import se.ironyy_be.dto.response.OrderDetailResponse;
import se.ironyy_be.dto.response.StatusUpdateResponse;
import se.ironyy_be.exception.BusinessLogicException;
import se.ironyy_be.exception.ResourceNotFoundException;
import se.ironyy_be.exception.UnauthorizedException;
import se.ironyy_be.mapper.OrderMapper;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.OrderItem;
import se.ironyy_be.pojo.OrderItemOption;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.DeliveryType;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.pojo.enums.Role;
import se.ironyy_be.repository.OrderRepository;
import se.ironyy_be.repository.UserRepository;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Order operations around the status workflow: creation, item and delivery edits, admin
 * pricing and assignment, draft deletion and reads. Status itself only changes through
 * {@link OrderWorkflowService}.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class OrderService {

    private static final Set<OrderStatus> EDITABLE_STATUSES =
            EnumSet.of(OrderStatus.DRAFT, OrderStatus.PENDING, OrderStatus.CONFIRMED);

    private final OrderRepository orderRepository;
    private final UserRepository userRepository;
    private final ServiceCatalog serviceCatalog;
    private final PricingService pricingService;
    private final OrderNumberGenerator orderNumberGenerator;
    private final OrderAuditService auditService;
    private final OrderWorkflowService workflowService;
    private final OrderMapper orderMapper;

    @Transactional
    public OrderDetailResponse createOrder(OrderCreateRequest request, User customer) {
        if (customer.getRole() != Role.CUSTOMER) {
            throw new UnauthorizedException("Only customers can place orders");
        }
        validateAddresses(request.getDeliveryType(), request.getDeliveryAddress());

        Order order = Order.builder()
                .orderNumber(orderNumberGenerator.nextOrderNumber())
                .customer(userRepository.getReferenceById(customer.getUserId()))
                .status(request.isSubmit() ? OrderStatus.PENDING : OrderStatus.DRAFT)
                .deliveryType(request.getDeliveryType())
                .pickupAddress(request.getPickupAddress())
                .deliveryAddress(request.getDeliveryAddress())
                .preferredPickupDate(request.getPreferredPickupDate())
                .preferredDeliveryDate(request.getPreferredDeliveryDate())
                .specialInstructions(request.getSpecialInstructions())
                .build();

        if (request.getItems() != null) {
            request.getItems().forEach(itemRequest -> order.addItem(buildItem(itemRequest)));
        }
        pricingService.recalculateTotals(order);

        Order saved = orderRepository.save(order);
        log.info("Customer {} created order {} in {} with {} items",
                customer.getEmail(), saved.getOrderNumber(), saved.getStatus(), saved.getOrderItems().size());
        return toDetail(saved, customer);
    }

    @Transactional
    public OrderDetailResponse addItem(Long orderId, OrderItemRequest request, User actor) {
        Order order = lockEditableOrder(orderId, actor);
        order.addItem(buildItem(request));
        pricingService.recalculateTotals(order);

        Order saved = flushLocked(order);
        log.info("Item added to order {} by {}", saved.getOrderNumber(), actor.getEmail());
        return toDetail(saved, actor);
    }

    @Transactional
    public OrderDetailResponse updateItem(Long orderId, Long itemId, OrderItemUpdateRequest request, User actor) {
        Order order = lockEditableOrder(orderId, actor);
        OrderItem item = findItem(order, itemId);

        if (request.getQuantity() != null) {
            item.setQuantity(request.getQuantity());
        }
        if (request.getDiscountAmount() != null) {
            item.setDiscountAmount(request.getDiscountAmount());
        }
        if (request.getDescription() != null) {
            item.setDescription(request.getDescription());
        }
        pricingService.recalculateTotals(order);

        Order saved = flushLocked(order);
        log.info("Item {} of order {} updated by {}", itemId, saved.getOrderNumber(), actor.getEmail());
        return toDetail(saved, actor);
    }

    @Transactional
    public OrderDetailResponse removeItem(Long orderId, Long itemId, User actor) {
        Order order = lockEditableOrder(orderId, actor);
        order.removeItem(findItem(order, itemId));
        pricingService.recalculateTotals(order);

        Order saved = flushLocked(order);
        log.info("Item {} removed from order {} by {}", itemId, saved.getOrderNumber(), actor.getEmail());
        return toDetail(saved, actor);
    }

    @Transactional
    public OrderDetailResponse updateDelivery(Long orderId, DeliveryUpdateRequest request, User actor) {
        Order order = lockEditableOrder(orderId, actor);
        validateAddresses(request.getDeliveryType(), request.getDeliveryAddress());

        order.setDeliveryType(request.getDeliveryType());
        order.setPickupAddress(request.getPickupAddress());
        order.setDeliveryAddress(request.getDeliveryAddress());
        order.setPreferredPickupDate(request.getPreferredPickupDate());
        order.setPreferredDeliveryDate(request.getPreferredDeliveryDate());
        pricingService.recalculateTotals(order);

        Order saved = flushLocked(order);
        log.info("Delivery details of order {} set to {} by {}", saved.getOrderNumber(), saved.getDeliveryType(), actor.getEmail());
        return toDetail(saved, actor);
    }

    @Transactional
    public OrderDetailResponse applyDiscount(Long orderId, DiscountRequest request, User admin) {
        requireAdmin(admin);
        Order order = lockOrder(orderId);
        requireNotTerminal(order);

        order.setDiscountAmount(request.getAmount());
        pricingService.recalculateTotals(order);

        Order saved = flushLocked(order);
        log.info("Admin {} set discount {} on order {}{}", admin.getEmail(), request.getAmount(), saved.getOrderNumber(),
                StringUtils.hasText(request.getReason()) ? " (" + request.getReason() + ")" : "");
        return toDetail(saved, admin);
    }

    /**
     * Refreshes every item's unit price and option adjustments from the current catalog.
     */
    @Transactional
    public OrderDetailResponse repriceItems(Long orderId, User admin) {
        requireAdmin(admin);
        Order order = lockOrder(orderId);
        requireItemsEditable(order);

        for (OrderItem item : order.getOrderItems()) {
            List<Long> optionIds = item.getOptions().stream()
                    .map(OrderItemOption::getOptionId)
                    .collect(Collectors.toList());
            CatalogQuote quote = serviceCatalog.lookup(item.getServiceId(), item.getVariantId(), optionIds);
            item.setName(quote.getDisplayName());
            item.setUnitPrice(quote.getUnitPrice());
            item.getOptions().clear();
            item.getOptions().addAll(toOptions(quote));
        }
        pricingService.recalculateTotals(order);

        Order saved = flushLocked(order);
        log.info("Admin {} repriced {} items on order {}, new total {}",
                admin.getEmail(), saved.getOrderItems().size(), saved.getOrderNumber(), saved.getTotalAmount());
        return toDetail(saved, admin);
    }

    @Transactional
    public OrderDetailResponse assignStaff(Long orderId, Long staffId, User admin) {
        requireAdmin(admin);
        Order order = lockOrder(orderId);
        User staff = findAssignee(staffId, Role.PRESS);

        if (order.getStatus().isTerminal() || !order.getStatus().hasReached(OrderStatus.CONFIRMED)) {
            throw new BusinessLogicException("Press staff can only be assigned to confirmed, unfinished orders");
        }
        order.setAssignedStaff(staff);

        Order saved = flushLocked(order);
        log.info("Admin {} assigned press user {} to order {}", admin.getEmail(), staff.getEmail(), saved.getOrderNumber());
        return toDetail(saved, admin);
    }

    @Transactional
    public OrderDetailResponse assignDeliveryPerson(Long orderId, Long deliveryId, User admin) {
        requireAdmin(admin);
        Order order = lockOrder(orderId);
        User courier = findAssignee(deliveryId, Role.DELIVERY);

        if (order.getStatus().isTerminal() || !order.getStatus().hasReached(OrderStatus.SCHEDULED_FOR_PICKUP)) {
            throw new BusinessLogicException("A delivery person can only be assigned once the order is scheduled for pickup");
        }
        order.setDeliveryPerson(courier);

        Order saved = flushLocked(order);
        log.info("Admin {} assigned delivery user {} to order {}", admin.getEmail(), courier.getEmail(), saved.getOrderNumber());
        return toDetail(saved, admin);
    }

    /**
     * Hard delete for abandoned drafts. Anything past DRAFT is cancelled instead.
     */
    @Transactional
    public void deleteDraft(Long orderId, User actor) {
        Order order = lockOrder(orderId);
        requireOwnerOrAdmin(order, actor);
        if (order.getStatus() != OrderStatus.DRAFT) {
            throw new BusinessLogicException("Only draft orders can be deleted, cancel the order instead");
        }

        orderRepository.delete(order);
        log.info("Draft order {} deleted by {}", order.getOrderNumber(), actor.getEmail());
    }

    public OrderDetailResponse getOrder(Long orderId, User viewer) {
        Order order = findVisibleOrder(orderId, viewer);
        return toDetail(order, viewer);
    }

    public List<StatusUpdateResponse> getStatusHistory(Long orderId, User viewer) {
        findVisibleOrder(orderId, viewer);
        return auditService.getHistory(orderId).stream()
                .map(orderMapper::convertToStatusUpdateResponse)
                .collect(Collectors.toList());
    }

    public Order findById(Long orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
    }

    private Order findVisibleOrder(Long orderId, User viewer) {
        Order order = findById(orderId);
        if (viewer.getRole() == Role.CUSTOMER && !viewer.hasAdminRights()
                && !order.getCustomer().getUserId().equals(viewer.getUserId())) {
            throw new UnauthorizedException("You can only view your own orders");
        }
        return order;
    }

    private OrderItem buildItem(OrderItemRequest request) {
        CatalogQuote quote = serviceCatalog.lookup(request.getServiceId(), request.getVariantId(), request.getOptionIds());
        OrderItem item = OrderItem.builder()
                .serviceId(quote.getServiceId())
                .variantId(quote.getVariantId())
                .name(quote.getDisplayName())
                .description(request.getDescription())
                .quantity(request.getQuantity())
                .unitPrice(quote.getUnitPrice())
                .discountAmount(request.getDiscountAmount() != null ? request.getDiscountAmount() : BigDecimal.ZERO)
                .build();
        item.getOptions().addAll(toOptions(quote));
        return item;
    }

    private List<OrderItemOption> toOptions(CatalogQuote quote) {
        return quote.getOptions().stream()
                .map(option -> OrderItemOption.builder()
                        .optionId(option.getOptionId())
                        .name(option.getName())
                        .priceAdjustment(option.getPriceAdjustment())
                        .build())
                .collect(Collectors.toList());
    }

    private OrderItem findItem(Order order, Long itemId) {
        return order.getOrderItems().stream()
                .filter(item -> item.getOrderItemId().equals(itemId))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Item " + itemId + " not found in order " + order.getOrderNumber()));
    }

    private Order lockOrder(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
    }

    private Order lockEditableOrder(Long orderId, User actor) {
        Order order = lockOrder(orderId);
        requireOwnerOrAdmin(order, actor);
        requireItemsEditable(order);
        return order;
    }

    private void requireItemsEditable(Order order) {
        if (!EDITABLE_STATUSES.contains(order.getStatus())) {
            throw new BusinessLogicException("Order " + order.getOrderNumber() + " can no longer be edited in status " + order.getStatus());
        }
    }

    // Locked orders are already managed; a flush cascades item inserts and orphan removal.
    private Order flushLocked(Order order) {
        orderRepository.flush();
        return order;
    }

    private User findAssignee(Long userId, Role role) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User not found with id: " + userId));
        if (user.getRole() != role || !user.isActive()) {
            throw new BusinessLogicException("User " + user.getEmail() + " is not an active " + role + " user");
        }
        return user;
    }

    private void validateAddresses(DeliveryType deliveryType, String deliveryAddress) {
        if (deliveryType == DeliveryType.DELIVERY && !StringUtils.hasText(deliveryAddress)) {
            throw new BusinessLogicException("A delivery address is required for delivery orders");
        }
    }

    private void requireOwnerOrAdmin(Order order, User actor) {
        if (!actor.hasAdminRights() && !order.getCustomer().getUserId().equals(actor.getUserId())) {
            throw new UnauthorizedException("Only the order's customer or an admin can change this order");
        }
    }

    private void requireAdmin(User actor) {
        if (!actor.hasAdminRights()) {
            throw new UnauthorizedException("Admin rights required");
        }
    }

    private void requireNotTerminal(Order order) {
        if (order.getStatus().isTerminal()) {
            throw new BusinessLogicException("Order " + order.getOrderNumber() + " is already " + order.getStatus());
        }
    }

    private OrderDetailResponse toDetail(Order order, User viewer) {
        return orderMapper.convertToDetailResponse(order, workflowService.allowedTransitionsFor(viewer, order));
    }
}
