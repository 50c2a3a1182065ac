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
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Price observed at a specific market. The commodity is persisted as (commoditySource, commodityId)
 * and exposed as a {@link CommodityRef}.
 */
@Document(collection = "market_price_reports")
@CompoundIndexes({
        @CompoundIndex(name = "commodity_date", def = "{'commoditySource': 1, 'commodityId': 1, 'dateRecorded': -1}"),
        @CompoundIndex(name = "verification_date", def = "{'verificationStatus': 1, 'dateRecorded': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class MarketPriceReport {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String commoditySource;
    private String commodityId;
    private String marketName;
    private MarketType marketType;
    private String marketLocation;
    private String provinceName;
    private String cityName;
    private BigDecimal price;
    private String unit;
    private QualityGrade qualityGrade;
    private LocalDate dateRecorded;
    private LocalTime timeRecorded;
    private String primaryImage;
    private List<String> additionalImages = new ArrayList<>();
    private String notes;
    private EntrySource entrySource;
    private String importBatchId;
    private VerificationStatus verificationStatus;
    private String verifiedBy;
    private Instant verifiedAt;
    private String reportedBy;
    private Double latitude;
    private Double longitude;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public CommodityRef getCommodity() {
        return commodityId == null ? null : CommodityRef.of(commoditySource, commodityId);
    }

    public void setCommodity(CommodityRef ref) {
        this.commoditySource = ref.sourceCode();
        this.commodityId = ref.id();
    }

    public enum MarketType {
        TRADITIONAL, MODERN, WHOLESALE, ONLINE
    }

    public enum QualityGrade {
        PREMIUM, STANDARD, ECONOMY
    }

    public enum EntrySource {
        MANUAL, IMPORT, API
    }

    public enum VerificationStatus {
        PENDING, VERIFIED, REJECTED
    }
}
