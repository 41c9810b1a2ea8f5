package com.rcassist.infrastructure.ai;

import com.rcassist.domain.analysis.model.ProviderName;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves the provider fallback order for one request.
 */
public final class ProviderOrder {

    private ProviderOrder() {
    }

    /**
     * An explicit list wins as given (duplicates removed). Otherwise a single preferred provider is
     * tried first, followed by the rest of the default order. With neither, the default order.
     *
     * @param explicit     providers named by the caller, may be empty
     * @param preferred    single preferred provider, may be null
     * @param defaultOrder configured default order
     */
    public static List<ProviderName> resolve(List<ProviderName> explicit,
                                             ProviderName preferred,
                                             List<ProviderName> defaultOrder) {
        if (explicit != null && !explicit.isEmpty()) {
            return List.copyOf(new LinkedHashSet<>(explicit));
        }
        Set<ProviderName> order = new LinkedHashSet<>();
        if (preferred != null) {
            order.add(preferred);
        }
        order.addAll(defaultOrder);
        return new ArrayList<>(order);
    }
}
