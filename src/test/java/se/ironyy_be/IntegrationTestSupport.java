package se.ironyy_be;

import org.hibernate.Hibernate;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.transaction.support.TransactionTemplate;
import se.ironyy_be.pojo.LaundryService;
import se.ironyy_be.pojo.Order;
import se.ironyy_be.pojo.ServiceOption;
import se.ironyy_be.pojo.ServiceVariant;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.OrderStatus;
import se.ironyy_be.pojo.enums.Role;
import se.ironyy_be.repository.LaundryServiceRepository;
import se.ironyy_be.repository.OrderNumberSequenceRepository;
import se.ironyy_be.repository.OrderRepository;
import se.ironyy_be.repository.OrderStatusUpdateRepository;
import se.ironyy_be.repository.UserRepository;
import se.ironyy_be.service.NotificationDispatcher;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared H2 context for the integration tests. Every test starts from empty tables.
 */
@SpringBootTest
public abstract class IntegrationTestSupport {

    private static final AtomicInteger ORDER_SEQ = new AtomicInteger();

    @Autowired
    protected UserRepository userRepository;
    @Autowired
    protected OrderRepository orderRepository;
    @Autowired
    protected OrderStatusUpdateRepository statusUpdateRepository;
    @Autowired
    protected OrderNumberSequenceRepository sequenceRepository;
    @Autowired
    protected LaundryServiceRepository laundryServiceRepository;
    @Autowired
    @Qualifier("orderTx")
    protected TransactionTemplate tx;

    @SpyBean
    protected NotificationDispatcher notificationDispatcher;

    @AfterEach
    void cleanDatabase() {
        statusUpdateRepository.deleteAllInBatch();
        orderRepository.deleteAll();
        sequenceRepository.deleteAllInBatch();
        laundryServiceRepository.deleteAll();
        userRepository.deleteAllInBatch();
    }

    protected User user(String email, Role role) {
        return userRepository.save(User.builder()
                .email(email)
                .passwordHash("{noop}secret")
                .firstName(role.name().charAt(0) + role.name().substring(1).toLowerCase())
                .lastName("Tester")
                .role(role)
                .build());
    }

    protected Order order(User customer, OrderStatus status) {
        return orderRepository.save(Order.builder()
                .orderNumber(String.format("T-%06d", ORDER_SEQ.incrementAndGet()))
                .customer(customer)
                .status(status)
                .build());
    }

    /**
     * Reloads an order with its assignees and items initialized.
     */
    protected Order reload(Long orderId) {
        return tx.execute(status -> {
            Order order = orderRepository.findById(orderId).orElseThrow();
            Hibernate.initialize(order.getCustomer());
            Hibernate.initialize(order.getAssignedStaff());
            Hibernate.initialize(order.getDeliveryPerson());
            Hibernate.initialize(order.getOrderItems());
            order.getOrderItems().forEach(item -> Hibernate.initialize(item.getOptions()));
            return order;
        });
    }

    /**
     * Dry cleaning at 12.00 with a "Suit" variant (+18.00) and a "Stain treatment" option (+5.00).
     */
    protected LaundryService dryCleaning() {
        LaundryService service = LaundryService.builder()
                .name("Dry Cleaning")
                .basePrice(new BigDecimal("12.00"))
                .build();
        service.getVariants().add(ServiceVariant.builder()
                .service(service).name("Suit").priceAdjustment(new BigDecimal("18.00")).build());
        service.getOptions().add(ServiceOption.builder()
                .service(service).name("Stain treatment").priceAdjustment(new BigDecimal("5.00")).build());
        service.getOptions().add(ServiceOption.builder()
                .service(service).name("Discontinued").priceAdjustment(new BigDecimal("1.00")).active(false).build());
        return laundryServiceRepository.save(service);
    }
}
