package se.ironyy_be.service;

import java.util.Collection;

/**
 * Read-only view of the laundry price list.
 */
public interface ServiceCatalog {

    /**
     * Quotes a service, an optional variant and a set of options.
     *
     * @throws se.ironyy_be.exception.ResourceNotFoundException if any of them is unknown or inactive
     */
    CatalogQuote lookup(Long serviceId, Long variantId, Collection<Long> optionIds);
}
