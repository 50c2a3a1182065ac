package com.hargapangan.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for market_price_reports.
 */
public interface MarketPriceReportRepository extends MongoRepository<MarketPriceReport, String>, MarketPriceReportRepositoryCustom {

    List<MarketPriceReport> findByImportBatchId(String importBatchId);

    long countByVerificationStatus(MarketPriceReport.VerificationStatus status);

    long countByMarketType(MarketPriceReport.MarketType marketType);
}
