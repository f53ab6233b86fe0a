package se.ironyy_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironyy_be.dto.response.AdminDashboardResponse;
import se.ironyy_be.dto.response.OrderListResponse;
import se.ironyy_be.dto.response.PagedResponse;
import se.ironyy_be.exception.UnauthorizedException;
import se.ironyy_be.mapper.OrderMapper;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.pojo.enums.OrderStatusBucket;
import se.ironyy_be.pojo.enums.Role;
import se.ironyy_be.repository.OrderRepository;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role-specific work queues. Each queue is a filter over status and assignment; terminal
 * orders never appear in the press or delivery queues.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class OrderDashboardService {

    static final Set<OrderStatus> PRESS_QUEUE = EnumSet.of(
            OrderStatus.CONFIRMED, OrderStatus.PICKED_UP, OrderStatus.PROCESSING, OrderStatus.READY);
    // open for any courier to pick up
    static final Set<OrderStatus> DELIVERY_OPEN = EnumSet.of(OrderStatus.SCHEDULED_FOR_PICKUP, OrderStatus.READY);
    // already underway with the assigned courier
    static final Set<OrderStatus> DELIVERY_ACTIVE = EnumSet.of(OrderStatus.OUT_FOR_PICKUP, OrderStatus.OUT_FOR_DELIVERY);

    private static final int TOP_STAFF = 5;

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;

    public PagedResponse<OrderListResponse> getCustomerOrders(User customer, OrderStatusBucket bucket, Pageable pageable) {
        Page<Order> orders = bucket == null
                ? orderRepository.findByCustomerUserIdOrderByCreatedAtDesc(customer.getUserId(), pageable)
                : orderRepository.findByCustomerUserIdAndStatusInOrderByCreatedAtDesc(customer.getUserId(), bucket.getStatuses(), pageable);
        return PagedResponse.of(orders.map(orderMapper::convertToListResponse));
    }

    /**
     * Orders a press user can accept or is already working on. Admins see every press-stage order.
     */
    public PagedResponse<OrderListResponse> getPressQueue(User actor, Pageable pageable) {
        requireRole(actor, Role.PRESS);
        Long staffId = actor.hasAdminRights() ? null : actor.getUserId();
        Page<Order> orders = orderRepository.findPressQueue(PRESS_QUEUE, staffId, pageable);
        return PagedResponse.of(orders.map(orderMapper::convertToListResponse));
    }

    /**
     * Unclaimed pickups and deliveries plus the courier's own trips in progress.
     */
    public PagedResponse<OrderListResponse> getDeliveryQueue(User actor, Pageable pageable) {
        requireRole(actor, Role.DELIVERY);
        Long deliveryId = actor.hasAdminRights() ? null : actor.getUserId();
        Page<Order> orders = orderRepository.findDeliveryQueue(DELIVERY_OPEN, DELIVERY_ACTIVE, deliveryId, pageable);
        return PagedResponse.of(orders.map(orderMapper::convertToListResponse));
    }

    public AdminDashboardResponse getAdminDashboard(User actor, Pageable pageable) {
        if (!actor.hasAdminRights()) {
            throw new UnauthorizedException("Admin rights required");
        }

        Map<String, Long> bucketCounts = new LinkedHashMap<>();
        for (OrderStatusBucket bucket : OrderStatusBucket.values()) {
            bucketCounts.put(bucket.getParam(), orderRepository.countByStatusIn(bucket.getStatuses()));
        }
        Map<String, Long> statusCounts = new LinkedHashMap<>();
        for (OrderStatus status : OrderStatus.values()) {
            statusCounts.put(status.name(), orderRepository.countByStatus(status));
        }

        Page<Order> orders = orderRepository.findAllByOrderByCreatedAtDesc(pageable);
        log.debug("Admin dashboard for {}: {} orders", actor.getEmail(), orders.getTotalElements());

        return AdminDashboardResponse.builder()
                .totalOrders(orderRepository.count())
                .bucketCounts(bucketCounts)
                .statusCounts(statusCounts)
                .topStaff(getTopStaff())
                .orders(PagedResponse.of(orders.map(orderMapper::convertToListResponse)))
                .build();
    }

    /**
     * Completed-order count and mean turnaround per press assignee, busiest five first.
     */
    public List<AdminDashboardResponse.StaffPerformance> getTopStaff() {
        return orderRepository.findStaffCompletionStats(TOP_STAFF).stream()
                .map(row -> AdminDashboardResponse.StaffPerformance.builder()
                        .staffId(((Number) row[0]).longValue())
                        .staffName(User.displayName((String) row[1], (String) row[2], (String) row[3]))
                        .completedOrders(((Number) row[4]).longValue())
                        .averageCompletionMinutes(row[5] != null ? ((Number) row[5]).doubleValue() : 0)
                        .build())
                .collect(Collectors.toList());
    }

    private void requireRole(User actor, Role role) {
        if (actor.getRole() != role && !actor.hasAdminRights()) {
            throw new UnauthorizedException("This queue is only available to " + role + " users");
        }
    }
}
