package se.ironyy_be.service;

import lombok.extern.slf4j.Slf4j;
import org.hibernate.Hibernate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import se.ironyy_be.exception.ConcurrentOrderModificationException;
import se.ironyy_be.exception.InvalidTransitionException;
import se.ironyy_be.exception.PersistenceFailureException;
import se.ironyy_be.exception.ResourceNotFoundException;
import se.ironyy_be.exception.UnauthorizedException;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.OrderStatusUpdate;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.pojo.enums.PaymentStatus;
import se.ironyy_be.pojo.enums.Role;
import se.ironyy_be.repository.OrderRepository;
import se.ironyy_be.repository.UserRepository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The only place an order's status changes. Each transition locks the order row, checks the
 * transition table and the actor's permission, applies the side effects, writes the audit
 * record in the same transaction and tells the notification dispatcher after commit.
 */
@Service
@Slf4j
public class OrderWorkflowService {

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(OrderStatus.DRAFT, EnumSet.of(OrderStatus.CONFIRMED, OrderStatus.PENDING, OrderStatus.CANCELLED));
        TRANSITIONS.put(OrderStatus.PENDING, EnumSet.of(OrderStatus.CONFIRMED, OrderStatus.CANCELLED));
        TRANSITIONS.put(OrderStatus.CONFIRMED, EnumSet.of(OrderStatus.SCHEDULED_FOR_PICKUP, OrderStatus.CANCELLED));
        TRANSITIONS.put(OrderStatus.SCHEDULED_FOR_PICKUP, EnumSet.of(OrderStatus.OUT_FOR_PICKUP, OrderStatus.CANCELLED));
        TRANSITIONS.put(OrderStatus.OUT_FOR_PICKUP, EnumSet.of(OrderStatus.PICKED_UP, OrderStatus.CANCELLED));
        TRANSITIONS.put(OrderStatus.PICKED_UP, EnumSet.of(OrderStatus.PROCESSING, OrderStatus.CANCELLED));
        TRANSITIONS.put(OrderStatus.PROCESSING, EnumSet.of(OrderStatus.READY, OrderStatus.CANCELLED));
        TRANSITIONS.put(OrderStatus.READY, EnumSet.of(OrderStatus.OUT_FOR_DELIVERY, OrderStatus.CANCELLED));
        TRANSITIONS.put(OrderStatus.OUT_FOR_DELIVERY, EnumSet.of(OrderStatus.COMPLETED, OrderStatus.CANCELLED));
        for (OrderStatus status : OrderStatus.values()) {
            if (status.isTerminal()) {
                TRANSITIONS.put(status, EnumSet.noneOf(OrderStatus.class));
            }
        }
    }

    private final OrderRepository orderRepository;
    private final UserRepository userRepository;
    private final OrderTransitionPolicy transitionPolicy;
    private final OrderAuditService auditService;
    private final PricingService pricingService;
    private final NotificationDispatcher notificationDispatcher;
    private final TransactionTemplate orderTx;
    private final boolean requirePaymentForConfirmation;

    public OrderWorkflowService(OrderRepository orderRepository,
                                UserRepository userRepository,
                                OrderTransitionPolicy transitionPolicy,
                                OrderAuditService auditService,
                                PricingService pricingService,
                                NotificationDispatcher notificationDispatcher,
                                @Qualifier("orderTx") TransactionTemplate orderTx,
                                @Value("${app.workflow.require-payment-for-confirmation:false}") boolean requirePaymentForConfirmation) {
        this.orderRepository = orderRepository;
        this.userRepository = userRepository;
        this.transitionPolicy = transitionPolicy;
        this.auditService = auditService;
        this.pricingService = pricingService;
        this.notificationDispatcher = notificationDispatcher;
        this.orderTx = orderTx;
        this.requirePaymentForConfirmation = requirePaymentForConfirmation;
    }

    public static Set<OrderStatus> allowedTransitionsFrom(OrderStatus status) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(status, EnumSet.noneOf(OrderStatus.class)));
    }

    public static boolean isAllowed(OrderStatus from, OrderStatus to) {
        return allowedTransitionsFrom(from).contains(to);
    }

    /**
     * Statuses {@code viewer} could move the order to right now, per the table and the policy.
     */
    public Set<OrderStatus> allowedTransitionsFor(User viewer, Order order) {
        Set<OrderStatus> allowed = EnumSet.noneOf(OrderStatus.class);
        for (OrderStatus candidate : allowedTransitionsFrom(order.getStatus())) {
            if (transitionPolicy.mayTransition(viewer, order, candidate)) {
                allowed.add(candidate);
            }
        }
        return allowed;
    }

    public TransitionResult applyTransition(Long orderId, OrderStatus requested, User actor, String notes) {
        return applyTransition(orderId, requested, actor, notes, null);
    }

    /**
     * Moves an order to {@code requested}.
     *
     * @param expectedVersion the order version the caller last saw, or null. When given, a
     *                        changed order fails at once instead of being re-read and retried.
     * @throws InvalidTransitionException           requested status is not reachable from the current one
     * @throws UnauthorizedException                actor may not request this status for this order
     * @throws ConcurrentOrderModificationException the order changed underneath the caller
     * @throws PersistenceFailureException          the store failed; nothing was applied
     */
    public TransitionResult applyTransition(Long orderId, OrderStatus requested, User actor, String notes, Long expectedVersion) {
        Objects.requireNonNull(requested, "requested status");
        if (actor == null || actor.getUserId() == null) {
            throw new UnauthorizedException("An authenticated user is required to change order status");
        }

        // Version the request was made against. A row that moved on while we waited for the
        // lock turns a failed check into a conflict instead of a rejection.
        Long observedVersion = expectedVersion != null
                ? expectedVersion
                : orderRepository.findVersionById(orderId).orElse(null);

        TransitionResult result;
        try {
            result = executeInTransaction(orderId, requested, actor, notes, expectedVersion, observedVersion);
        } catch (ConcurrencyFailureException first) {
            if (expectedVersion != null) {
                throw conflict(orderId, first);
            }
            log.warn("Concurrent update on order {} while moving to {}, retrying once", orderId, requested);
            try {
                result = executeInTransaction(orderId, requested, actor, notes, null, observedVersion);
            } catch (ConcurrencyFailureException second) {
                throw conflict(orderId, second);
            }
        }

        dispatchQuietly(result.getOrder(), result.getUpdate().getFromStatus(), requested);
        return result;
    }

    private TransitionResult executeInTransaction(Long orderId, OrderStatus requested, User actor, String notes,
                                                  Long expectedVersion, Long observedVersion) {
        try {
            return orderTx.execute(status -> transition(orderId, requested, actor, notes, expectedVersion, observedVersion));
        } catch (ConcurrencyFailureException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Persistence failure while moving order {} to {}: {}", orderId, requested, e.getMessage());
            throw new PersistenceFailureException("Order status could not be saved, please try again later", e);
        }
    }

    private TransitionResult transition(Long orderId, OrderStatus requested, User actor, String notes,
                                        Long expectedVersion, Long observedVersion) {
        Order order = orderRepository.findByIdForUpdate(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));

        if (expectedVersion != null && !expectedVersion.equals(order.getVersion())) {
            log.warn("Order {} is at version {}, caller expected {}", orderId, order.getVersion(), expectedVersion);
            throw new ConcurrentOrderModificationException(orderId,
                    "Order was modified by someone else, reload it and try again");
        }

        User managedActor = userRepository.findById(actor.getUserId())
                .orElseThrow(() -> new UnauthorizedException("Unknown user: " + actor.getUserId()));
        OrderStatus previous = order.getStatus();
        boolean changedSinceRead = observedVersion != null && !observedVersion.equals(order.getVersion());

        if (claimedByAnother(order, managedActor, requested)) {
            log.warn("Order {} was already claimed at {} by another user, {} lost", orderId, previous, managedActor.getEmail());
            throw new UnauthorizedException("This order has already been taken by someone else");
        }
        if (!isAllowed(previous, requested)) {
            if (changedSinceRead) {
                throw changedUnderneath(orderId, order.getVersion(), observedVersion);
            }
            log.warn("Rejected transition of order {} from {} to {} by {}", orderId, previous, requested, managedActor.getEmail());
            throw new InvalidTransitionException(previous, requested);
        }
        if (!transitionPolicy.mayTransition(managedActor, order, requested)) {
            if (changedSinceRead) {
                throw changedUnderneath(orderId, order.getVersion(), observedVersion);
            }
            log.warn("User {} ({}) is not allowed to move order {} from {} to {}",
                    managedActor.getEmail(), managedActor.getRole(), orderId, previous, requested);
            throw new UnauthorizedException("You are not allowed to move this order to " + requested);
        }
        if (requested == OrderStatus.CONFIRMED && requirePaymentForConfirmation
                && order.getPaymentStatus() != PaymentStatus.PAID) {
            log.warn("Order {} cannot be confirmed with payment status {}", orderId, order.getPaymentStatus());
            throw new InvalidTransitionException(previous, requested, "Order must be paid before it can be confirmed");
        }

        order.setStatus(requested);
        order.stampLifecycle(requested, LocalDateTime.now());
        claimIfUnassigned(order, managedActor, requested);
        if (requested == OrderStatus.CANCELLED && !StringUtils.hasText(order.getCancellationReason())
                && StringUtils.hasText(notes)) {
            order.setCancellationReason(notes.trim());
        }
        pricingService.refreshTotalsIfStale(order);
        Order saved = orderRepository.saveAndFlush(order);

        OrderStatusUpdate update = auditService.record(saved, previous, requested, managedActor, notes);

        initializeForResponse(saved);
        log.info("Order {} moved {} -> {} by {}", saved.getOrderNumber(), previous, requested, managedActor.getEmail());
        return new TransitionResult(saved, update);
    }

    /**
     * True when the actor asks for the claiming status the order already holds and someone
     * else holds the claim, i.e. the actor lost the race for it.
     */
    private boolean claimedByAnother(Order order, User actor, OrderStatus requested) {
        if (actor.hasAdminRights() || order.getStatus() != requested) {
            return false;
        }
        if (actor.getRole() == Role.DELIVERY && requested == OrderStatus.OUT_FOR_PICKUP) {
            return order.getDeliveryPerson() != null && !OrderTransitionPolicy.sameUser(order.getDeliveryPerson(), actor);
        }
        if (actor.getRole() == Role.PRESS && requested == OrderStatus.SCHEDULED_FOR_PICKUP) {
            return order.getAssignedStaff() != null && !OrderTransitionPolicy.sameUser(order.getAssignedStaff(), actor);
        }
        return false;
    }

    private void claimIfUnassigned(Order order, User actor, OrderStatus requested) {
        if (actor.hasAdminRights()) {
            return;
        }
        if (actor.getRole() == Role.PRESS && order.getAssignedStaff() == null) {
            order.setAssignedStaff(actor);
            log.info("Order {} claimed by press user {}", order.getOrderNumber(), actor.getEmail());
        }
        if (actor.getRole() == Role.DELIVERY && requested == OrderStatus.OUT_FOR_PICKUP && order.getDeliveryPerson() == null) {
            order.setDeliveryPerson(actor);
            log.info("Order {} claimed by delivery user {}", order.getOrderNumber(), actor.getEmail());
        }
    }

    // The order leaves the transaction detached; load what the mapper and the dispatcher read.
    private void initializeForResponse(Order order) {
        Hibernate.initialize(order.getCustomer());
        Hibernate.initialize(order.getAssignedStaff());
        Hibernate.initialize(order.getDeliveryPerson());
        Hibernate.initialize(order.getOrderItems());
        order.getOrderItems().forEach(item -> Hibernate.initialize(item.getOptions()));
    }

    private void dispatchQuietly(Order order, OrderStatus from, OrderStatus to) {
        try {
            notificationDispatcher.notify(order, from, to);
        } catch (RuntimeException e) {
            log.warn("Notification for order {} ({} -> {}) failed: {}", order.getOrderNumber(), from, to, e.getMessage());
        }
    }

    private ConcurrentOrderModificationException changedUnderneath(Long orderId, Long current, Long observed) {
        log.warn("Order {} moved from version {} to {} while waiting for the lock", orderId, observed, current);
        return new ConcurrentOrderModificationException(orderId,
                "Order was changed by someone else in the meantime, reload it and try again");
    }

    private ConcurrentOrderModificationException conflict(Long orderId, Exception cause) {
        log.warn("Giving up on order {} after a concurrent update: {}", orderId, cause.getMessage());
        return new ConcurrentOrderModificationException(orderId,
                "Order is being updated by someone else, please try again", cause);
    }
}
