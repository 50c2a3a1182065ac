package com.hargapangan.domain;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.regex.Pattern;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of MarketPriceReportRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class MarketPriceReportRepositoryImpl implements MarketPriceReportRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Page<MarketPriceReport> search(MarketPriceFilter filter, Pageable pageable) {
        Criteria criteria = where("active").is(true);
        if (filter.marketType() != null) {
            criteria = criteria.and("marketType").is(filter.marketType());
        }
        if (filter.qualityGrade() != null) {
            criteria = criteria.and("qualityGrade").is(filter.qualityGrade());
        }
        if (filter.verificationStatus() != null) {
            criteria = criteria.and("verificationStatus").is(filter.verificationStatus());
        }
        if (filter.entrySource() != null) {
            criteria = criteria.and("entrySource").is(filter.entrySource());
        }
        if (hasText(filter.commodityId())) {
            criteria = criteria.and("commodityId").is(filter.commodityId());
        }
        if (hasText(filter.provinceName())) {
            criteria = criteria.and("provinceName").regex(contains(filter.provinceName()));
        }
        if (hasText(filter.cityName())) {
            criteria = criteria.and("cityName").regex(contains(filter.cityName()));
        }
        if (hasText(filter.marketName())) {
            criteria = criteria.and("marketName").regex(contains(filter.marketName()));
        }
        if (filter.from() != null || filter.to() != null) {
            Criteria date = criteria.and("dateRecorded");
            if (filter.from() != null) {
                date = date.gte(filter.from());
            }
            if (filter.to() != null) {
                date.lte(filter.to());
            }
        }
        Query query = Query.query(criteria);
        long total = mongoTemplate.count(query, MarketPriceReport.class);
        query.with(Sort.by(Sort.Order.desc("dateRecorded"), Sort.Order.desc("createdAt"))).with(pageable);
        List<MarketPriceReport> content = mongoTemplate.find(query, MarketPriceReport.class);
        return new PageImpl<>(content, pageable, total);
    }

    @Override
    public List<CommodityAverage> averagePriceByCommodity() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(where("active").is(true)),
                Aggregation.group("commoditySource", "commodityId")
                        .avg("price").as("avgPrice")
                        .count().as("reports"),
                Aggregation.sort(Sort.Direction.DESC, "reports")
        );
        return mongoTemplate.aggregate(aggregation, MarketPriceReport.class, Document.class)
                .getMappedResults().stream()
                .map(d -> {
                    Document key = d.get("_id", Document.class);
                    return new CommodityAverage(
                            key != null ? key.getString("commoditySource") : null,
                            key != null ? key.getString("commodityId") : null,
                            PricePointRepositoryImpl.toBigDecimal(d.get("avgPrice")),
                            d.get("reports") instanceof Number n ? n.longValue() : 0L);
                })
                .toList();
    }

    private static Pattern contains(String text) {
        return Pattern.compile(Pattern.quote(text.strip()), Pattern.CASE_INSENSITIVE);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
