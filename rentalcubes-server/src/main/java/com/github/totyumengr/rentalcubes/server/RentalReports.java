/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.rentalcubes.server;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.github.totyumengr.rentalcubes.core.Aggregations;
import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.CubeQuery;
import com.github.totyumengr.rentalcubes.core.CubeQuery.CubeQueryBuilder;
import com.github.totyumengr.rentalcubes.core.FactTable.Meta;
import com.github.totyumengr.rentalcubes.core.RentalDerivedDimensions;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSetSpec;
import com.github.totyumengr.rentalcubes.core.predicate.ComparisonOperator;
import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.predicate.Operand;
import com.github.totyumengr.rentalcubes.core.rank.BucketSummary;
import com.github.totyumengr.rentalcubes.core.rank.RankedEntity;
import com.github.totyumengr.rentalcubes.core.rank.Ranker;
import com.github.totyumengr.rentalcubes.core.result.OrderKey;
import com.github.totyumengr.rentalcubes.core.result.OrderKey.Direction;

/**
 * Canned reports of the rental business, each one a {@link CubeQueryBuilder} template bound to the current
 * fact-table on request.
 *
 * @author mengran
 *
 */
@Component
public class RentalReports {

    private static final Logger LOGGER = LoggerFactory.getLogger(RentalReports.class);

    public static final LocalDate REPORTING_START = LocalDate.of(2018, 1, 1);

    public static final int DECILES = 10;

    private final Map<String, Function<Meta, CubeQueryBuilder>> reports =
            new LinkedHashMap<String, Function<Meta, CubeQueryBuilder>>();

    public RentalReports() {
        super();

        // Audience by country and gender with all subtotals
        reports.put("demographics", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.cube("country", "gender"))
                .measures("rating")
                .countDistinct("customerId"));
        reports.put("genre-releases", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.cube("genre", "yearOfRelease"))
                .measures("rating"));
        reports.put("country-gender", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.rollup("country", "gender"))
                .measures("rating"));
        reports.put("country-genre", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.rollup("country", "genre"))
                .measures("rating")
                .where(Condition.isNotNull("rating")));
        reports.put("rating-sets", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.groupingSets(Arrays.asList("country", "gender"),
                        Arrays.asList(Arrays.asList("country", "gender"),
                                Arrays.asList("country"), Arrays.asList("gender"),
                                Collections.<String>emptyList())))
                .measures("rating")
                .where(Condition.and(Condition.isNotNull("rating"),
                        Condition.dateRange("rentalDate", REPORTING_START, null))));
        reports.put("revenue", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.cube("country", "genre", RentalDerivedDimensions.RENTAL_YEAR))
                .measures("price", "rating")
                .countDistinct("customerId")
                .where(Condition.and(Condition.isNotNull("country"), Condition.isNotNull("genre"))));
        // Loyal customers, best spenders first
        reports.put("customer-value", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.groupBy("customerId", "country"))
                .measures("price", "rentalDate")
                .having(Condition.compare(Operand.countAll(), ComparisonOperator.GE, 5))
                .orderBy(OrderKey.aggregate(AggregateFunction.SUM, "price", Direction.DESC)));
        reports.put("customer-deciles", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.groupBy("customerId"))
                .measures("price")
                .rank(AggregateFunction.SUM, "price", DECILES)
                .orderBy(OrderKey.bucket(Direction.ASC)));
        reports.put("vip-customers", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.groupBy("customerId"))
                .measures("price")
                .having(Condition.compare(Operand.countAll(), ComparisonOperator.GT, 10))
                .orderBy(OrderKey.aggregate(AggregateFunction.COUNT, null, Direction.DESC)));
        reports.put("dissatisfied-customers", meta -> new CubeQueryBuilder(meta)
                .groupBy(GroupingSetSpec.groupBy("customerId"))
                .measures("rating")
                .having(Condition.compare(Operand.min("rating"), ComparisonOperator.LT, 4)));
    }

    public Set<String> names() {
        return reports.keySet();
    }

    public boolean contains(String name) {
        return reports.containsKey(name);
    }

    /**
     * @param name report name
     * @param meta fact-table to run on
     * @param totalMarker marker of rolled-up dimensions
     * @return validated query
     * @throws CubeConfigurationException if report is unknown or does not fit the fact-table
     */
    public CubeQuery report(String name, Meta meta, String totalMarker) throws CubeConfigurationException {

        Function<Meta, CubeQueryBuilder> template = reports.get(name);
        if (template == null) {
            throw new CubeConfigurationException("Unknown report " + name + ", choose one of " + names());
        }
        return template.apply(meta).totalMarker(totalMarker).done();
    }

    /**
     * Customer spend deciles summarized as "Top 10%" (decile 1) and "Bottom 50%" (deciles 6 to 10).
     * @param aggregations calculation target
     * @return segment name to summary of customer spend
     */
    public Map<String, BucketSummary> spendSegments(Aggregations aggregations) {

        Map<Object, BigDecimal> spend = aggregations.sum("price", "customerId", null);
        List<RankedEntity<Object>> ranked = new Ranker(DECILES).rank(spend, (a, b) -> ValueType.compareValues(a, b));

        Map<String, BucketSummary> segments = new LinkedHashMap<String, BucketSummary>(2);
        segments.put("Top 10%", Ranker.summarize(ranked, 1, 1));
        segments.put("Bottom 50%", Ranker.summarize(ranked, 6, DECILES));
        LOGGER.info("Spend segments of {} customers {}", ranked.size(), segments);
        return segments;
    }

}
