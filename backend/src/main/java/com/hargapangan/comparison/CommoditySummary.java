package com.hargapangan.comparison;

import com.hargapangan.domain.Commodity;

/**
 * Commodity fields embedded in price views.
 */
public record CommoditySummary(String id, String name, String unit, String category, String iconUrl) {

    static CommoditySummary of(Commodity c) {
        if (c == null) {
            return null;
        }
        return new CommoditySummary(c.getId(), c.getName(), c.getUnit(),
                c.getCategory() != null ? c.getCategory().getCode() : null, c.getIconUrl());
    }

    static CommoditySummary unknown(String id) {
        return new CommoditySummary(id, null, null, null, null);
    }
}
