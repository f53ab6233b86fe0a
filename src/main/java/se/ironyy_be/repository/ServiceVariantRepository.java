package se.ironyy_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.ironyy_be.pojo.ServiceVariant;

import java.util.Optional;

public interface ServiceVariantRepository extends JpaRepository<ServiceVariant, Long> {
    Optional<ServiceVariant> findByVariantIdAndServiceServiceIdAndActiveTrue(Long variantId, Long serviceId);
}
