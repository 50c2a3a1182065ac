package com.hargapangan.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One ledger price for (commodity, date, region, source, level). At most one automatic row per key;
 * an override-flagged row for the same (commodity, date, region) suppresses sync writes.
 */
@Document(collection = "price_points")
@CompoundIndexes({
        @CompoundIndex(name = "ledger_key", def = "{'commodityId': 1, 'date': 1, 'regionId': 1, 'source': 1, 'level': 1}", unique = true),
        @CompoundIndex(name = "date_override", def = "{'date': 1, 'override': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PricePoint {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String commodityId;
    private String regionId;
    private BigDecimal price;
    private LocalDate date;
    private PriceSource source;
    private boolean override;
    private PriceLevel level;
    private Instant createdAt;
    private Instant updatedAt;
}
