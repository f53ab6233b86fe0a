package se.ironyy_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.ironyy_be.exception.ResourceNotFoundException;
import se.ironyy_be.pojo.LaundryService;
import se.ironyy_be.pojo.ServiceOption;
import se.ironyy_be.pojo.ServiceVariant;
import se.ironyy_be.repository.LaundryServiceRepository;
import se.ironyy_be.repository.ServiceOptionRepository;
import se.ironyy_be.repository.ServiceVariantRepository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
@Slf4j
public class JpaServiceCatalog implements ServiceCatalog {

    private final LaundryServiceRepository laundryServiceRepository;
    private final ServiceVariantRepository serviceVariantRepository;
    private final ServiceOptionRepository serviceOptionRepository;

    @Override
    public CatalogQuote lookup(Long serviceId, Long variantId, Collection<Long> optionIds) {
        LaundryService service = laundryServiceRepository.findByServiceIdAndActiveTrue(serviceId)
                .orElseThrow(() -> new ResourceNotFoundException("Service not found or inactive: " + serviceId));

        BigDecimal unitPrice = service.getBasePrice();
        String variantName = null;
        if (variantId != null) {
            ServiceVariant variant = serviceVariantRepository
                    .findByVariantIdAndServiceServiceIdAndActiveTrue(variantId, serviceId)
                    .orElseThrow(() -> new ResourceNotFoundException(
                            "Variant " + variantId + " not found for service " + serviceId));
            unitPrice = unitPrice.add(variant.getPriceAdjustment());
            variantName = variant.getName();
        }

        List<CatalogQuote.OptionQuote> options = List.of();
        if (optionIds != null && !optionIds.isEmpty()) {
            Set<Long> requested = new LinkedHashSet<>(optionIds);
            List<ServiceOption> found = serviceOptionRepository
                    .findByOptionIdInAndServiceServiceIdAndActiveTrue(requested, serviceId);
            if (found.size() != requested.size()) {
                Set<Long> foundIds = found.stream().map(ServiceOption::getOptionId).collect(Collectors.toSet());
                requested.removeAll(foundIds);
                throw new ResourceNotFoundException("Options not available for service " + serviceId + ": " + requested);
            }
            options = found.stream()
                    .sorted(Comparator.comparing(ServiceOption::getOptionId))
                    .map(option -> CatalogQuote.OptionQuote.builder()
                            .optionId(option.getOptionId())
                            .name(option.getName())
                            .priceAdjustment(option.getPriceAdjustment())
                            .build())
                    .collect(Collectors.toList());
        }

        log.debug("Quoted service {} variant {} with {} options at {}", serviceId, variantId, options.size(), unitPrice);
        return CatalogQuote.builder()
                .serviceId(serviceId)
                .variantId(variantId)
                .serviceName(service.getName())
                .variantName(variantName)
                .unitPrice(unitPrice)
                .options(options)
                .build();
    }
}
