package se.ironyy_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.ironyy_be.pojo.ServiceOption;

import java.util.Collection;
import java.util.List;

public interface ServiceOptionRepository extends JpaRepository<ServiceOption, Long> {
    List<ServiceOption> findByOptionIdInAndServiceServiceIdAndActiveTrue(Collection<Long> optionIds, Long serviceId);
}
