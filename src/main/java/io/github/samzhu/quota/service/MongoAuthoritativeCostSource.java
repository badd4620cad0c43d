package io.github.samzhu.quota.service;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Service;

import io.github.samzhu.quota.document.RequestCostRecord;
import io.github.samzhu.quota.model.PeriodType;
import io.github.samzhu.quota.util.PeriodUtils;

/**
 * 由 {@code request_costs} 聚合出權威成本。
 *
 * <p>等同以下 pipeline（以月度為例）：
 * <pre>
 * [ { $match: { monthlyPeriodKey: "2026-01" } },
 *   { $group: { _id: "$userId", total: { $sum: "$costUsd" } } } ]
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/aggregation-framework.html">Spring Data MongoDB Aggregation</a>
 */
@Service
public class MongoAuthoritativeCostSource implements AuthoritativeCostSource {

    private final MongoTemplate mongoTemplate;

    public MongoAuthoritativeCostSource(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Map<String, BigDecimal> totalsByUser(String periodKey) {
        String keyField = PeriodUtils.typeOf(periodKey) == PeriodType.MONTHLY
            ? "monthlyPeriodKey"
            : "dailyPeriodKey";

        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.match(Criteria.where(keyField).is(periodKey)),
            Aggregation.group("userId").sum("costUsd").as("total"));

        AggregationResults<Document> results =
            mongoTemplate.aggregate(aggregation, RequestCostRecord.class, Document.class);

        Map<String, BigDecimal> totals = new HashMap<>();
        for (Document doc : results.getMappedResults()) {
            Number total = (Number) doc.get("total");
            totals.put(doc.getString("_id"), BigDecimal.valueOf(total == null ? 0.0 : total.doubleValue()));
        }
        return totals;
    }
}
