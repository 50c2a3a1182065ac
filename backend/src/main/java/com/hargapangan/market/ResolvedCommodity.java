package com.hargapangan.market;

import com.hargapangan.domain.CommodityRef;

/**
 * A commodity reference together with the display fields of whichever registry it points into.
 */
public record ResolvedCommodity(CommodityRef ref, String name, String unit, String category) {
}
