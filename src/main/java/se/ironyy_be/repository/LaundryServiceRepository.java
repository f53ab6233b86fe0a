package se.ironyy_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.ironyy_be.pojo.LaundryService;

import java.util.Optional;

public interface LaundryServiceRepository extends JpaRepository<LaundryService, Long> {
    Optional<LaundryService> findByServiceIdAndActiveTrue(Long serviceId);
}
