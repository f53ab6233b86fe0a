package se.ironyy_be.dbinit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import se.ironyy_be.pojo.LaundryService;
import se.ironyy_be.pojo.ServiceOption;
import se.ironyy_be.pojo.ServiceVariant;
import se.ironyy_be.pojo.User;
import se.ironyy_be.pojo.enums.Role;
import se.ironyy_be.repository.LaundryServiceRepository;
import se.ironyy_be.service.UserService;

import java.math.BigDecimal;
import java.util.List;

/**
 * Demo users (one per role plus a superuser, password {@code password}) and a small catalog.
 */
@Component
@ConditionalOnProperty(name = "app.data-init.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private static final String DEMO_PASSWORD = "password";

    private final UserService userService;
    private final LaundryServiceRepository laundryServiceRepository;
    private final PasswordEncoder passwordEncoder;

    public DataInitializer(UserService userService,
                           LaundryServiceRepository laundryServiceRepository,
                           PasswordEncoder passwordEncoder) {
        this.userService = userService;
        this.laundryServiceRepository = laundryServiceRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    @Transactional
    public void run(String... args) {
        initUsers();
        initCatalog();
    }

    private void initUsers() {
        createUserIfMissing("customer@ironyy.local", "Casey", "Customer", Role.CUSTOMER, false);
        createUserIfMissing("press@ironyy.local", "Pat", "Presser", Role.PRESS, false);
        createUserIfMissing("delivery@ironyy.local", "Dana", "Driver", Role.DELIVERY, false);
        createUserIfMissing("admin@ironyy.local", "Alex", "Admin", Role.ADMIN, false);
        // superuser keeps a customer role; the flag alone grants admin rights
        createUserIfMissing("root@ironyy.local", "Root", null, Role.CUSTOMER, true);
    }

    private void createUserIfMissing(String email, String firstName, String lastName, Role role, boolean superuser) {
        if (userService.existsByEmail(email)) {
            return;
        }
        userService.save(User.builder()
                .email(email)
                .passwordHash(passwordEncoder.encode(DEMO_PASSWORD))
                .firstName(firstName)
                .lastName(lastName)
                .role(role)
                .superuser(superuser)
                .build());
        log.info("Seeded {} user {}", superuser ? "superuser" : role, email);
    }

    private void initCatalog() {
        if (laundryServiceRepository.count() > 0) {
            return;
        }

        LaundryService washAndFold = service("Wash & Fold", "Washed, dried and folded, priced per bag", "15.00");
        variant(washAndFold, "Small bag", "0.00");
        variant(washAndFold, "Large bag", "10.00");
        option(washAndFold, "Hypoallergenic detergent", "2.00");
        option(washAndFold, "Fabric softener", "1.50");

        LaundryService dryCleaning = service("Dry Cleaning", "Solvent cleaning for delicate garments", "12.00");
        variant(dryCleaning, "Shirt", "0.00");
        variant(dryCleaning, "Suit", "18.00");
        variant(dryCleaning, "Dress", "8.00");
        option(dryCleaning, "Stain treatment", "5.00");
        option(dryCleaning, "Express (24h)", "7.50");

        LaundryService ironing = service("Ironing", "Pressing only, per piece", "4.00");
        variant(ironing, "Shirt", "0.00");
        variant(ironing, "Trousers", "1.00");
        option(ironing, "Hanger finish", "0.50");

        laundryServiceRepository.saveAll(List.of(washAndFold, dryCleaning, ironing));
        log.info("Seeded laundry catalog with 3 services");
    }

    private LaundryService service(String name, String description, String basePrice) {
        return LaundryService.builder()
                .name(name)
                .description(description)
                .basePrice(new BigDecimal(basePrice))
                .build();
    }

    private void variant(LaundryService service, String name, String priceAdjustment) {
        service.getVariants().add(ServiceVariant.builder()
                .service(service)
                .name(name)
                .priceAdjustment(new BigDecimal(priceAdjustment))
                .build());
    }

    private void option(LaundryService service, String name, String priceAdjustment) {
        service.getOptions().add(ServiceOption.builder()
                .service(service)
                .name(name)
                .priceAdjustment(new BigDecimal(priceAdjustment))
                .build());
    }
}
