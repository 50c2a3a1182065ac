package com.hargapangan.comparison;

import java.util.List;

public record CurrentPricePage(List<CurrentPriceRow> items, long total, int page, int size) {
}
