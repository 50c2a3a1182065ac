package com.hargapangan.ingestion.store;

import com.hargapangan.domain.PriceLevel;
import com.hargapangan.domain.PricePoint;
import com.hargapangan.domain.PricePointRepository;
import com.hargapangan.domain.PriceSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PriceLedgerStoreTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 10);

    @Mock
    PricePointRepository repository;

    PriceLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new PriceLedgerStore(repository, Clock.fixed(Instant.parse("2026-03-10T01:00:00Z"), ZoneOffset.UTC));
    }

    private static PricePoint row(String price) {
        PricePoint p = new PricePoint();
        p.setId("pp-1");
        p.setCommodityId("c1");
        p.setDate(DAY);
        p.setLevel(PriceLevel.KONSUMEN);
        p.setSource(PriceSource.API);
        p.setPrice(new BigDecimal(price));
        return p;
    }

    @Test
    void insertsApiRowWhenMissing() {
        when(repository.findByCommodityIdAndDateAndRegionIdAndSourceAndLevel("c1", DAY, null, PriceSource.API, PriceLevel.KONSUMEN))
                .thenReturn(Optional.empty());
        when(repository.insert(any(PricePoint.class))).thenAnswer(inv -> inv.getArgument(0));

        PriceLedgerStore.WriteResult result = store.upsertAutomatic("c1", DAY, null, PriceLevel.KONSUMEN, new BigDecimal("12500"));

        assertThat(result.outcome()).isEqualTo(PriceLedgerStore.WriteResult.Outcome.INSERTED);
        ArgumentCaptor<PricePoint> captor = ArgumentCaptor.forClass(PricePoint.class);
        verify(repository).insert(captor.capture());
        assertThat(captor.getValue().getSource()).isEqualTo(PriceSource.API);
        assertThat(captor.getValue().isOverride()).isFalse();
        assertThat(captor.getValue().getPrice()).isEqualByComparingTo("12500");
    }

    @Test
    void equalPriceIsNotRewritten() {
        when(repository.findByCommodityIdAndDateAndRegionIdAndSourceAndLevel("c1", DAY, null, PriceSource.API, PriceLevel.KONSUMEN))
                .thenReturn(Optional.of(row("12500.00")));

        PriceLedgerStore.WriteResult result = store.upsertAutomatic("c1", DAY, null, PriceLevel.KONSUMEN, new BigDecimal("12500"));

        assertThat(result.wrote()).isFalse();
        verify(repository, never()).save(any());
    }

    @Test
    void changedPriceUpdatesAndReportsPrevious() {
        PricePoint existing = row("12000");
        when(repository.findByCommodityIdAndDateAndRegionIdAndSourceAndLevel("c1", DAY, null, PriceSource.API, PriceLevel.KONSUMEN))
                .thenReturn(Optional.of(existing));
        when(repository.save(existing)).thenReturn(existing);

        PriceLedgerStore.WriteResult result = store.upsertAutomatic("c1", DAY, null, PriceLevel.KONSUMEN, new BigDecimal("12500"));

        assertThat(result.outcome()).isEqualTo(PriceLedgerStore.WriteResult.Outcome.UPDATED);
        assertThat(result.previousPrice()).isEqualByComparingTo("12000");
        assertThat(existing.getPrice()).isEqualByComparingTo("12500");
    }

    @Test
    void lostInsertRaceRetriesAsUpdate() {
        PricePoint winner = row("12000");
        when(repository.findByCommodityIdAndDateAndRegionIdAndSourceAndLevel("c1", DAY, null, PriceSource.API, PriceLevel.KONSUMEN))
                .thenReturn(Optional.empty(), Optional.of(winner));
        when(repository.insert(any(PricePoint.class))).thenThrow(new DuplicateKeyException("E11000 ledger_key"));
        when(repository.save(winner)).thenReturn(winner);

        PriceLedgerStore.WriteResult result = store.upsertAutomatic("c1", DAY, null, PriceLevel.KONSUMEN, new BigDecimal("12500"));

        assertThat(result.outcome()).isEqualTo(PriceLedgerStore.WriteResult.Outcome.UPDATED);
        assertThat(winner.getPrice()).isEqualByComparingTo("12500");
    }
}
