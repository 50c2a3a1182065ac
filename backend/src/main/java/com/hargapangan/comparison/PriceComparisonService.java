package com.hargapangan.comparison;

import com.hargapangan.common.Percentages;
import com.hargapangan.config.CaffeineConfig;
import com.hargapangan.domain.Commodity;
import com.hargapangan.domain.CommodityCategory;
import com.hargapangan.domain.CommodityPriceAggregate;
import com.hargapangan.domain.CommodityRepository;
import com.hargapangan.domain.PriceLevel;
import com.hargapangan.domain.PriceOverride;
import com.hargapangan.domain.PriceOverrideRepository;
import com.hargapangan.domain.PricePoint;
import com.hargapangan.domain.PricePointRepository;
import com.hargapangan.domain.PriceSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-side views over the price ledger: per-day api vs manual comparison, per-commodity history,
 * top movers, period statistics and the current price board. Results go through {@link PriceViewCache}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceComparisonService {

    public static final String COMMODITY_NOT_FOUND = "COMMODITY_NOT_FOUND";
    public static final String INVALID_RANGE = "INVALID_RANGE";

    static final int DEFAULT_HISTORY_DAYS = 30;
    static final int DEFAULT_TOP_MOVERS = 10;
    private static final int SCALE = 2;
    private static final int MAX_PAGE_SIZE = 200;

    private final PricePointRepository pricePointRepository;
    private final CommodityRepository commodityRepository;
    private final PriceOverrideRepository overrideRepository;
    private final PriceViewCache cache;
    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Per commodity and price level on the date: automatic price, manual price, the active one (manual wins) and
     * manual minus automatic. For an applied override the automatic price is the one it replaced.
     */
    public List<DayComparisonRow> compareDay(LocalDate date) {
        LocalDate day = date != null ? date : today();
        return cache.get(CaffeineConfig.COMPARISON_CACHE, day, () -> computeDayComparison(day));
    }

    private List<DayComparisonRow> computeDayComparison(LocalDate day) {
        List<PricePoint> rows = pricePointRepository.findByDateOrderByCommodityIdAsc(day);
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<String, PriceOverride> appliedByPoint = overrideRepository
                .findByPricePointIdInAndStatus(rows.stream().map(PricePoint::getId).toList(), PriceOverride.Status.APPROVED)
                .stream()
                .collect(Collectors.toMap(PriceOverride::getPricePointId, Function.identity(), (a, b) -> b));
        Map<String, Commodity> commodities = commoditiesById(rows.stream().map(PricePoint::getCommodityId).toList());

        Map<LedgerSeries, BigDecimal[]> prices = new LinkedHashMap<>();
        for (PricePoint row : rows) {
            BigDecimal[] slot = prices.computeIfAbsent(LedgerSeries.of(row), k -> new BigDecimal[3]);
            if (row.getSource() == PriceSource.API) {
                if (slot[0] == null) {
                    slot[0] = row.getPrice();
                }
            } else {
                slot[1] = row.getPrice();
                PriceOverride applied = appliedByPoint.get(row.getId());
                if (applied != null && applied.getOriginalSource() == PriceSource.API && slot[0] == null) {
                    slot[0] = applied.getOriginalPrice();
                }
            }
            if (row.isOverride()) {
                slot[2] = row.getPrice();
            }
        }

        List<DayComparisonRow> out = new ArrayList<>(prices.size());
        for (Map.Entry<LedgerSeries, BigDecimal[]> e : prices.entrySet()) {
            BigDecimal api = e.getValue()[0];
            BigDecimal manual = e.getValue()[1];
            BigDecimal active = e.getValue()[2] != null ? e.getValue()[2] : (manual != null ? manual : api);
            BigDecimal delta = null;
            BigDecimal deltaPct = null;
            if (api != null && manual != null) {
                delta = manual.subtract(api).setScale(SCALE, RoundingMode.HALF_UP);
                deltaPct = Percentages.change(api, manual);
            }
            out.add(new DayComparisonRow(summary(commodities, e.getKey().commodityId()), e.getKey().levelCode(),
                    api, manual, active, delta, deltaPct));
        }
        return List.copyOf(out);
    }

    /**
     * Price series for a commodity, oldest first. Defaults: to = today, from = to - 30 days.
     *
     * @throws PriceQueryException COMMODITY_NOT_FOUND, INVALID_RANGE
     */
    public PriceHistory dayOverDay(String commodityId, LocalDate from, LocalDate to, String regionId) {
        LocalDate end = to != null ? to : today();
        LocalDate start = from != null ? from : end.minusDays(DEFAULT_HISTORY_DAYS);
        if (start.isAfter(end)) {
            throw new PriceQueryException(INVALID_RANGE, "from must not be after to");
        }
        Commodity commodity = commodityRepository.findById(commodityId)
                .orElseThrow(() -> new PriceQueryException(COMMODITY_NOT_FOUND, "Commodity not found: " + commodityId));
        String key = commodityId + "|" + start + "|" + end + "|" + regionId;
        return cache.get(CaffeineConfig.HISTORY_CACHE, key, () -> {
            List<PricePoint> rows = regionId != null && !regionId.isBlank()
                    ? pricePointRepository.findByCommodityIdAndRegionIdAndDateBetweenOrderByDateAsc(commodityId, regionId, start, end)
                    : pricePointRepository.findByCommodityIdAndDateBetweenOrderByDateAsc(commodityId, start, end);
            List<PriceHistory.Point> series = rows.stream()
                    .map(p -> new PriceHistory.Point(p.getDate(), p.getPrice(),
                            p.getSource() != null ? p.getSource().getCode() : null,
                            p.isOverride(),
                            p.getLevel() != null ? p.getLevel().getCode() : null))
                    .toList();
            return new PriceHistory(CommoditySummary.of(commodity), start, end, series, historyStats(series));
        });
    }

    static PriceHistory.Stats historyStats(List<PriceHistory.Point> series) {
        List<BigDecimal> prices = series.stream().map(PriceHistory.Point::price).filter(p -> p != null).toList();
        BigDecimal zero = BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        if (prices.isEmpty()) {
            return new PriceHistory.Stats(zero, zero, zero, zero, zero);
        }
        BigDecimal min = prices.stream().min(Comparator.naturalOrder()).orElseThrow();
        BigDecimal max = prices.stream().max(Comparator.naturalOrder()).orElseThrow();
        BigDecimal sum = prices.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal avg = sum.divide(BigDecimal.valueOf(prices.size()), SCALE, RoundingMode.HALF_UP);
        BigDecimal first = prices.get(0);
        BigDecimal current = prices.get(prices.size() - 1);
        return new PriceHistory.Stats(min, max, avg, current, Percentages.change(first, current));
    }

    /**
     * (commodity, level) series ranked by absolute percentage change between their first and last
     * price inside [start, end], largest first. Series with fewer than two dated prices are left out.
     */
    public List<TopMover> topMovers(LocalDate start, LocalDate end, int limit) {
        LocalDate to = end != null ? end : today();
        LocalDate from = start != null ? start : to.minusDays(7);
        if (from.isAfter(to)) {
            throw new PriceQueryException(INVALID_RANGE, "start must not be after end");
        }
        int n = limit > 0 ? limit : DEFAULT_TOP_MOVERS;
        return computeTopMovers(pricePointRepository.findByDateBetweenOrderByDateAsc(from, to), n);
    }

    private List<TopMover> computeTopMovers(List<PricePoint> rows, int limit) {
        Map<LedgerSeries, PricePoint> first = new LinkedHashMap<>();
        Map<LedgerSeries, PricePoint> last = new LinkedHashMap<>();
        for (PricePoint row : rows) {
            if (row.getPrice() == null || row.getDate() == null) {
                continue;
            }
            LedgerSeries series = LedgerSeries.of(row);
            first.putIfAbsent(series, row);
            last.put(series, row);
        }
        Map<String, Commodity> commodities = commoditiesById(first.keySet().stream().map(LedgerSeries::commodityId).toList());
        List<TopMover> movers = new ArrayList<>();
        for (Map.Entry<LedgerSeries, PricePoint> e : first.entrySet()) {
            PricePoint a = e.getValue();
            PricePoint b = last.get(e.getKey());
            if (b == null || !b.getDate().isAfter(a.getDate()) || a.getPrice().signum() == 0) {
                continue;
            }
            movers.add(new TopMover(summary(commodities, e.getKey().commodityId()), e.getKey().levelCode(),
                    a.getDate(), a.getPrice(), b.getDate(), b.getPrice(),
                    Percentages.change(a.getPrice(), b.getPrice())));
        }
        movers.sort(Comparator.comparing((TopMover m) -> m.changePct().abs()).reversed());
        return movers.size() > limit ? List.copyOf(movers.subList(0, limit)) : List.copyOf(movers);
    }

    /**
     * avg/min/max/count per commodity and level for the period ending today, plus top 10 movers of the same window.
     */
    public PriceStatistics statistics(String period, String regionId) {
        StatisticsPeriod p = StatisticsPeriod.fromCode(period);
        LocalDate to = today();
        LocalDate from = to.minusDays(p.getDays());
        String key = p.getCode() + "|" + to + "|" + regionId;
        return cache.get(CaffeineConfig.STATISTICS_CACHE, key, () -> {
            List<CommodityPriceAggregate> aggregates = pricePointRepository.aggregateByCommodity(from, to,
                    regionId != null && !regionId.isBlank() ? regionId : null);
            Map<String, Commodity> commodities = commoditiesById(aggregates.stream().map(CommodityPriceAggregate::commodityId).toList());
            List<PriceStatistics.CommodityStats> stats = aggregates.stream()
                    .map(a -> new PriceStatistics.CommodityStats(summary(commodities, a.commodityId()),
                            a.level() != null ? a.level().getCode() : null,
                            a.avgPrice(), a.minPrice(), a.maxPrice(), a.dataPoints()))
                    .toList();
            List<TopMover> movers = computeTopMovers(pricePointRepository.findByDateBetweenOrderByDateAsc(from, to), DEFAULT_TOP_MOVERS);
            return new PriceStatistics(p.getCode(), from, to, stats, movers);
        });
    }

    /**
     * Ledger prices of the date (default today) joined with commodity and the previous day's price.
     * Only active commodities are listed; category and search (name substring) are optional.
     */
    public CurrentPricePage currentPrices(LocalDate date, String regionId, String category, String search, int page, int size) {
        LocalDate day = date != null ? date : today();
        int safePage = Math.max(0, page);
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        String key = day + "|" + regionId + "|" + category + "|" + search + "|" + safePage + "|" + safeSize;
        return cache.get(CaffeineConfig.CURRENT_PRICES_CACHE, key,
                () -> computeCurrentPrices(day, regionId, category, search, safePage, safeSize));
    }

    private CurrentPricePage computeCurrentPrices(LocalDate day, String regionId, String category, String search, int page, int size) {
        CommodityCategory cat = CommodityCategory.fromCode(category);
        String needle = search != null && !search.isBlank() ? search.strip().toLowerCase(Locale.ROOT) : null;
        boolean byRegion = regionId != null && !regionId.isBlank();

        List<PricePoint> rows = pricePointRepository.findByDateOrderByCommodityIdAsc(day).stream()
                .filter(p -> !byRegion || regionId.equals(p.getRegionId()))
                .filter(p -> p.getPrice() != null && p.getPrice().signum() > 0)
                .toList();
        Map<String, Commodity> commodities = commoditiesById(rows.stream().map(PricePoint::getCommodityId).toList());
        List<PricePoint> matching = rows.stream()
                .filter(p -> {
                    Commodity c = commodities.get(p.getCommodityId());
                    if (c == null || !c.isActive()) {
                        return false;
                    }
                    if (category != null && !category.isBlank() && cat != c.getCategory()) {
                        return false;
                    }
                    return needle == null || (c.getName() != null && c.getName().toLowerCase(Locale.ROOT).contains(needle));
                })
                .toList();

        int fromIndex = Math.min(page * size, matching.size());
        int toIndex = Math.min(fromIndex + size, matching.size());
        List<PricePoint> pageRows = matching.subList(fromIndex, toIndex);

        Set<String> ids = pageRows.stream().map(PricePoint::getCommodityId).collect(Collectors.toCollection(HashSet::new));
        Map<String, BigDecimal> yesterday = new LinkedHashMap<>();
        if (!ids.isEmpty()) {
            for (PricePoint p : pricePointRepository.findByDateAndCommodityIdIn(day.minusDays(1), ids)) {
                if (!byRegion || regionId.equals(p.getRegionId())) {
                    yesterday.put(p.getCommodityId(), p.getPrice());
                }
            }
        }

        List<CurrentPriceRow> items = pageRows.stream()
                .map(p -> toCurrentRow(p, commodities.get(p.getCommodityId()), yesterday.get(p.getCommodityId())))
                .toList();
        return new CurrentPricePage(items, matching.size(), page, size);
    }

    static CurrentPriceRow toCurrentRow(PricePoint p, Commodity c, BigDecimal yesterdayPrice) {
        BigDecimal gap = yesterdayPrice != null
                ? p.getPrice().subtract(yesterdayPrice).setScale(SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO.setScale(SCALE, RoundingMode.HALF_UP);
        BigDecimal gapPct = Percentages.change(yesterdayPrice, p.getPrice());
        String trend = gap.signum() > 0 ? "up" : gap.signum() < 0 ? "down" : "stable";
        return new CurrentPriceRow(
                p.getId(),
                CommoditySummary.of(c),
                p.getPrice(),
                yesterdayPrice,
                gap,
                gapPct,
                trend,
                p.getSource() != null ? p.getSource().getCode() : null,
                p.isOverride(),
                p.getLevel() != null ? p.getLevel().getCode() : null,
                p.getRegionId(),
                p.getDate());
    }

    private static CommoditySummary summary(Map<String, Commodity> commodities, String commodityId) {
        Commodity c = commodities.get(commodityId);
        return c != null ? CommoditySummary.of(c) : CommoditySummary.unknown(commodityId);
    }

    private Map<String, Commodity> commoditiesById(Collection<String> ids) {
        Set<String> unique = new HashSet<>(ids);
        unique.remove(null);
        if (unique.isEmpty()) {
            return Map.of();
        }
        return commodityRepository.findByIdIn(unique).stream()
                .collect(Collectors.toMap(Commodity::getId, Function.identity(), (a, b) -> a));
    }

    /** One price series of the ledger: a commodity quoted at one supply-chain level. */
    private record LedgerSeries(String commodityId, PriceLevel level) {

        static LedgerSeries of(PricePoint row) {
            return new LedgerSeries(row.getCommodityId(), row.getLevel());
        }

        String levelCode() {
            return level != null ? level.getCode() : null;
        }
    }
}
