package com.hargapangan.domain;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of PricePointRepositoryCustom using the MongoTemplate aggregation pipeline.
 */
@Repository
@RequiredArgsConstructor
public class PricePointRepositoryImpl implements PricePointRepositoryCustom {

    private static final int SCALE = 2;

    private final MongoTemplate mongoTemplate;

    @Override
    public List<CommodityPriceAggregate> aggregateByCommodity(LocalDate from, LocalDate to, String regionId) {
        Criteria criteria = where("date").gte(from).lte(to);
        if (regionId != null) {
            criteria = criteria.and("regionId").is(regionId);
        }
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(criteria),
                Aggregation.group("commodityId", "level")
                        .avg("price").as("avgPrice")
                        .min("price").as("minPrice")
                        .max("price").as("maxPrice")
                        .count().as("dataPoints"),
                Aggregation.sort(Sort.Direction.ASC, "commodityId", "level")
        );
        AggregationResults<Document> results = mongoTemplate.aggregate(aggregation, PricePoint.class, Document.class);
        return results.getMappedResults().stream()
                .map(d -> {
                    Document key = d.get("_id", Document.class);
                    Object commodityId = key != null ? key.get("commodityId") : null;
                    Object level = key != null ? key.get("level") : null;
                    return new CommodityPriceAggregate(
                            commodityId != null ? commodityId.toString() : null,
                            level != null ? PriceLevel.fromCode(level.toString()) : null,
                            toBigDecimal(d.get("avgPrice")),
                            toBigDecimal(d.get("minPrice")),
                            toBigDecimal(d.get("maxPrice")),
                            d.get("dataPoints") instanceof Number n ? n.longValue() : 0L);
                })
                .toList();
    }

    static BigDecimal toBigDecimal(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof Decimal128 d) {
            return d.bigDecimalValue().setScale(SCALE, RoundingMode.HALF_UP);
        }
        if (value instanceof BigDecimal b) {
            return b.setScale(SCALE, RoundingMode.HALF_UP);
        }
        if (value instanceof Number n) {
            return BigDecimal.valueOf(n.doubleValue()).setScale(SCALE, RoundingMode.HALF_UP);
        }
        return new BigDecimal(value.toString()).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
