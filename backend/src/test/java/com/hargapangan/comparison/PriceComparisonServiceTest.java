package com.hargapangan.comparison;

import com.hargapangan.domain.Commodity;
import com.hargapangan.domain.CommodityCategory;
import com.hargapangan.domain.CommodityPriceAggregate;
import com.hargapangan.domain.CommodityRepository;
import com.hargapangan.domain.PriceLedgerChangedEvent;
import com.hargapangan.domain.PriceLevel;
import com.hargapangan.domain.PriceOverride;
import com.hargapangan.domain.PriceOverrideRepository;
import com.hargapangan.domain.PricePoint;
import com.hargapangan.domain.PricePointRepository;
import com.hargapangan.domain.PriceSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceComparisonServiceTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    @Mock
    PricePointRepository pricePointRepository;
    @Mock
    CommodityRepository commodityRepository;
    @Mock
    PriceOverrideRepository overrideRepository;

    PriceViewCache cache;
    PriceComparisonService service;

    private final Commodity x = commodity("cx", "Cabai Rawit", CommodityCategory.BUMBU);
    private final Commodity y = commodity("cy", "Daging Sapi", CommodityCategory.DAGING);

    @BeforeEach
    void setUp() {
        cache = new PriceViewCache(new ConcurrentMapCacheManager());
        service = new PriceComparisonService(pricePointRepository, commodityRepository, overrideRepository, cache,
                Clock.fixed(Instant.parse("2026-03-10T05:00:00Z"), ZoneId.of("Asia/Jakarta")));
    }

    private static Commodity commodity(String id, String name, CommodityCategory category) {
        Commodity c = new Commodity();
        c.setId(id);
        c.setName(name);
        c.setUnit("Rp/kg");
        c.setCategory(category);
        c.setActive(true);
        return c;
    }

    private static PricePoint point(String id, String commodityId, LocalDate date, String price, PriceSource source, boolean override) {
        PricePoint p = new PricePoint();
        p.setId(id);
        p.setCommodityId(commodityId);
        p.setDate(date);
        p.setPrice(new BigDecimal(price));
        p.setSource(source);
        p.setOverride(override);
        p.setLevel(PriceLevel.KONSUMEN);
        return p;
    }

    private static PricePoint point(String id, String commodityId, LocalDate date, String price, PriceLevel level) {
        PricePoint p = point(id, commodityId, date, price, PriceSource.API, false);
        p.setLevel(level);
        return p;
    }

    @Test
    @DisplayName("top movers rank by absolute change: 10000->15000 above 20000->19000")
    void topMoversRanking() {
        when(pricePointRepository.findByDateBetweenOrderByDateAsc(DAY.minusDays(7), DAY)).thenReturn(List.of(
                point("p1", "cx", DAY.minusDays(7), "10000", PriceSource.API, false),
                point("p2", "cy", DAY.minusDays(7), "20000", PriceSource.API, false),
                point("p3", "cx", DAY, "15000", PriceSource.API, false),
                point("p4", "cy", DAY, "19000", PriceSource.API, false)));
        when(commodityRepository.findByIdIn(anyCollection())).thenReturn(List.of(x, y));

        List<TopMover> movers = service.topMovers(DAY.minusDays(7), DAY, 10);

        assertThat(movers).extracting(m -> m.commodity().id()).containsExactly("cx", "cy");
        assertThat(movers.get(0).changePct()).isEqualByComparingTo("50.00");
        assertThat(movers.get(1).changePct()).isEqualByComparingTo("-5.00");
    }

    @Test
    @DisplayName("producer and consumer prices of one commodity are ranked as separate series")
    void topMoversKeepLevelsApart() {
        when(pricePointRepository.findByDateBetweenOrderByDateAsc(DAY.minusDays(7), DAY)).thenReturn(List.of(
                point("p1", "cx", DAY.minusDays(7), "8000", PriceLevel.PRODUSEN),
                point("p2", "cx", DAY.minusDays(7), "10000", PriceLevel.KONSUMEN),
                point("p3", "cx", DAY, "8400", PriceLevel.PRODUSEN),
                point("p4", "cx", DAY, "12000", PriceLevel.KONSUMEN)));
        when(commodityRepository.findByIdIn(anyCollection())).thenReturn(List.of(x));

        List<TopMover> movers = service.topMovers(DAY.minusDays(7), DAY, 10);

        assertThat(movers).extracting(TopMover::level).containsExactly("konsumen", "produsen");
        assertThat(movers.get(0).startPrice()).isEqualByComparingTo("10000");
        assertThat(movers.get(0).changePct()).isEqualByComparingTo("20.00");
        assertThat(movers.get(1).endPrice()).isEqualByComparingTo("8400");
        assertThat(movers.get(1).changePct()).isEqualByComparingTo("5.00");
    }

    @Test
    @DisplayName("a commodity priced on a single date is not a mover")
    void topMoversNeedTwoDates() {
        when(pricePointRepository.findByDateBetweenOrderByDateAsc(DAY.minusDays(7), DAY)).thenReturn(List.of(
                point("p1", "cx", DAY, "10000", PriceSource.API, false)));

        assertThat(service.topMovers(DAY.minusDays(7), DAY, 10)).isEmpty();
    }

    @Test
    void topMoversRejectInvertedRange() {
        assertThatThrownBy(() -> service.topMovers(DAY, DAY.minusDays(1), 10))
                .isInstanceOf(PriceQueryException.class)
                .satisfies(e -> assertThat(((PriceQueryException) e).getErrorCode()).isEqualTo(PriceComparisonService.INVALID_RANGE));
    }

    @Test
    @DisplayName("compareDay recovers the replaced api price of an applied override")
    void compareDayWithOverride() {
        PricePoint overridden = point("p1", "cx", DAY, "20000", PriceSource.MANUAL, true);
        PricePoint plain = point("p2", "cy", DAY, "130000", PriceSource.API, false);
        PriceOverride applied = new PriceOverride();
        applied.setPricePointId("p1");
        applied.setOriginalPrice(new BigDecimal("12500"));
        applied.setOriginalSource(PriceSource.API);
        applied.setStatus(PriceOverride.Status.APPROVED);
        when(pricePointRepository.findByDateOrderByCommodityIdAsc(DAY)).thenReturn(List.of(overridden, plain));
        when(overrideRepository.findByPricePointIdInAndStatus(List.of("p1", "p2"), PriceOverride.Status.APPROVED))
                .thenReturn(List.of(applied));
        when(commodityRepository.findByIdIn(anyCollection())).thenReturn(List.of(x, y));

        List<DayComparisonRow> rows = service.compareDay(DAY);

        assertThat(rows).hasSize(2);
        DayComparisonRow cx = rows.get(0);
        assertThat(cx.commodity().name()).isEqualTo("Cabai Rawit");
        assertThat(cx.apiPrice()).isEqualByComparingTo("12500");
        assertThat(cx.manualPrice()).isEqualByComparingTo("20000");
        assertThat(cx.activePrice()).isEqualByComparingTo("20000");
        assertThat(cx.delta()).isEqualByComparingTo("7500");
        assertThat(cx.deltaPct()).isEqualByComparingTo("60.00");
        DayComparisonRow cy = rows.get(1);
        assertThat(cy.manualPrice()).isNull();
        assertThat(cy.activePrice()).isEqualByComparingTo("130000");
        assertThat(cy.delta()).isNull();
    }

    @Test
    @DisplayName("compareDay reports one row per commodity and level")
    void compareDayKeepsLevelsApart() {
        PricePoint wholesale = point("p1", "cx", DAY, "45000", PriceLevel.GROSIR);
        PricePoint consumer = point("p2", "cx", DAY, "58000", PriceLevel.KONSUMEN);
        PricePoint consumerOverride = point("p3", "cx", DAY, "60000", PriceSource.MANUAL, true);
        when(pricePointRepository.findByDateOrderByCommodityIdAsc(DAY)).thenReturn(List.of(wholesale, consumer, consumerOverride));
        when(overrideRepository.findByPricePointIdInAndStatus(List.of("p1", "p2", "p3"), PriceOverride.Status.APPROVED))
                .thenReturn(List.of());
        when(commodityRepository.findByIdIn(anyCollection())).thenReturn(List.of(x));

        List<DayComparisonRow> rows = service.compareDay(DAY);

        assertThat(rows).extracting(DayComparisonRow::level).containsExactly("grosir", "konsumen");
        DayComparisonRow grosir = rows.get(0);
        assertThat(grosir.apiPrice()).isEqualByComparingTo("45000");
        assertThat(grosir.manualPrice()).isNull();
        assertThat(grosir.activePrice()).isEqualByComparingTo("45000");
        DayComparisonRow konsumen = rows.get(1);
        assertThat(konsumen.apiPrice()).isEqualByComparingTo("58000");
        assertThat(konsumen.manualPrice()).isEqualByComparingTo("60000");
        assertThat(konsumen.activePrice()).isEqualByComparingTo("60000");
        assertThat(konsumen.delta()).isEqualByComparingTo("2000");
    }

    @Test
    @DisplayName("statistics carry the level of each aggregate and rank movers per level")
    void statisticsPerLevel() {
        when(pricePointRepository.aggregateByCommodity(DAY.minusDays(7), DAY, null)).thenReturn(List.of(
                new CommodityPriceAggregate("cx", PriceLevel.PRODUSEN, new BigDecimal("8200.00"), new BigDecimal("8000.00"),
                        new BigDecimal("8400.00"), 2),
                new CommodityPriceAggregate("cx", PriceLevel.KONSUMEN, new BigDecimal("11000.00"), new BigDecimal("10000.00"),
                        new BigDecimal("12000.00"), 2)));
        when(pricePointRepository.findByDateBetweenOrderByDateAsc(DAY.minusDays(7), DAY)).thenReturn(List.of(
                point("p1", "cx", DAY.minusDays(7), "8000", PriceLevel.PRODUSEN),
                point("p2", "cx", DAY.minusDays(7), "10000", PriceLevel.KONSUMEN),
                point("p3", "cx", DAY, "8400", PriceLevel.PRODUSEN),
                point("p4", "cx", DAY, "12000", PriceLevel.KONSUMEN)));
        when(commodityRepository.findByIdIn(anyCollection())).thenReturn(List.of(x));

        PriceStatistics stats = service.statistics("7d", null);

        assertThat(stats.statistics()).extracting(PriceStatistics.CommodityStats::level).containsExactly("produsen", "konsumen");
        assertThat(stats.statistics()).allSatisfy(s -> assertThat(s.commodity().name()).isEqualTo("Cabai Rawit"));
        assertThat(stats.topMovers()).hasSize(2);
    }

    @Test
    @DisplayName("cached comparison is served until the ledger changes")
    void compareDayIsCachedUntilLedgerChange() {
        when(pricePointRepository.findByDateOrderByCommodityIdAsc(DAY)).thenReturn(List.of());

        service.compareDay(DAY);
        service.compareDay(DAY);
        verify(pricePointRepository, times(1)).findByDateOrderByCommodityIdAsc(DAY);

        cache.onLedgerChanged(new PriceLedgerChangedEvent(DAY, "sync"));
        service.compareDay(DAY);
        verify(pricePointRepository, times(2)).findByDateOrderByCommodityIdAsc(DAY);
    }

    @Test
    @DisplayName("history defaults to the last 30 days and summarises the series")
    void historyDefaultsAndStats() {
        when(commodityRepository.findById("cx")).thenReturn(Optional.of(x));
        when(pricePointRepository.findByCommodityIdAndDateBetweenOrderByDateAsc("cx", DAY.minusDays(30), DAY)).thenReturn(List.of(
                point("p1", "cx", DAY.minusDays(2), "10000", PriceSource.API, false),
                point("p2", "cx", DAY.minusDays(1), "11000", PriceSource.API, false),
                point("p3", "cx", DAY, "12000", PriceSource.MANUAL, true)));

        PriceHistory history = service.dayOverDay("cx", null, null, null);

        assertThat(history.from()).isEqualTo(DAY.minusDays(30));
        assertThat(history.series()).hasSize(3);
        assertThat(history.series().get(2).override()).isTrue();
        assertThat(history.stats().min()).isEqualByComparingTo("10000");
        assertThat(history.stats().max()).isEqualByComparingTo("12000");
        assertThat(history.stats().avg()).isEqualByComparingTo("11000");
        assertThat(history.stats().current()).isEqualByComparingTo("12000");
        assertThat(history.stats().changePct()).isEqualByComparingTo("20.00");
    }

    @Test
    void historyOfUnknownCommodity() {
        when(commodityRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.dayOverDay("nope", null, null, null))
                .isInstanceOf(PriceQueryException.class)
                .satisfies(e -> assertThat(((PriceQueryException) e).getErrorCode()).isEqualTo(PriceComparisonService.COMMODITY_NOT_FOUND));
    }

    @Test
    void emptyHistoryStatsAreZero() {
        PriceHistory.Stats stats = PriceComparisonService.historyStats(List.of());

        assertThat(stats.min()).isEqualByComparingTo("0");
        assertThat(stats.changePct()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("current row trend follows the gap to yesterday")
    void currentRowTrend() {
        PricePoint today = point("p1", "cx", DAY, "12500", PriceSource.API, false);

        CurrentPriceRow up = PriceComparisonService.toCurrentRow(today, x, new BigDecimal("12000"));
        CurrentPriceRow none = PriceComparisonService.toCurrentRow(today, x, null);

        assertThat(up.trend()).isEqualTo("up");
        assertThat(up.gapPct()).isEqualByComparingTo("4.17");
        assertThat(none.trend()).isEqualTo("stable");
    }

    @Test
    @DisplayName("current prices filter by category and page in memory")
    void currentPricesFilterAndPage() {
        when(pricePointRepository.findByDateOrderByCommodityIdAsc(DAY)).thenReturn(List.of(
                point("p1", "cx", DAY, "12500", PriceSource.API, false),
                point("p2", "cy", DAY, "130000", PriceSource.API, false)));
        when(commodityRepository.findByIdIn(anyCollection())).thenReturn(List.of(x, y));
        when(pricePointRepository.findByDateAndCommodityIdIn(eq(DAY.minusDays(1)), anyCollection())).thenReturn(List.of());

        CurrentPricePage page = service.currentPrices(null, null, "daging", null, 0, 20);

        assertThat(page.total()).isEqualTo(1);
        assertThat(page.items()).extracting(r -> r.commodity().id()).containsExactly("cy");
    }
}
