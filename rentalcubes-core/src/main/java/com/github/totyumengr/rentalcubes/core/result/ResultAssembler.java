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
package com.github.totyumengr.rentalcubes.core.result;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.QueryContext;
import com.github.totyumengr.rentalcubes.core.aggregate.Accumulator;
import com.github.totyumengr.rentalcubes.core.grouping.GroupKey;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSet;
import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.predicate.GroupBinding;
import com.github.totyumengr.rentalcubes.core.predicate.GroupEvaluationContext;
import com.github.totyumengr.rentalcubes.core.rank.RankedEntity;
import com.github.totyumengr.rentalcubes.core.result.OrderKey.Direction;
import com.github.totyumengr.rentalcubes.core.result.OrderKey.NullOrdering;

/**
 * Turns the merged accumulator map into ordered result rows: HAVING filter, per grouping set ranking, then sorting.
 *
 * <p>HAVING only decides visibility, accumulators are read and never changed. Rows equal on every ORDER BY key are
 * ordered by their group key, dimensions ascending with missing values and totals last.
 *
 * @author mengran
 *
 */
public class ResultAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultAssembler.class);

    private final List<String> dimensions;
    private final Condition having;
    private final List<OrderKey> orderKeys;
    private final RankingRequest ranking;
    private final String totalMarker;

    private final Comparator<ResultRow> canonicalOrder;

    /**
     * @param dimensions configured grouping dimensions
     * @param having post-aggregation filter, <code>null</code> keeps every group
     * @param orderKeys caller order, may be empty
     * @param ranking ranking request, <code>null</code> for none
     * @param totalMarker display value of rolled-up slots
     */
    public ResultAssembler(List<String> dimensions, Condition having, List<OrderKey> orderKeys,
            RankingRequest ranking, String totalMarker) {
        super();
        Assert.notEmpty(dimensions, "Dimensions can not be empty.");
        Assert.notNull(orderKeys, "Order keys can not be null.");
        this.dimensions = Collections.unmodifiableList(new ArrayList<String>(dimensions));
        this.having = having;
        this.orderKeys = Collections.unmodifiableList(new ArrayList<OrderKey>(orderKeys));
        this.ranking = ranking;
        this.totalMarker = totalMarker;

        this.canonicalOrder = new Comparator<ResultRow>() {

            @Override
            public int compare(ResultRow o1, ResultRow o2) {

                for (int i = 0; i < ResultAssembler.this.dimensions.size(); i++) {
                    int compared = OrderKey.compareSlots(o1.getKey().getSlot(i), o2.getKey().getSlot(i),
                            Direction.ASC, NullOrdering.NULLS_LAST);
                    if (compared != 0) {
                        return compared;
                    }
                }
                return Integer.compare(o1.getGroupingSet().getIndex(), o2.getGroupingSet().getIndex());
            }
        };
    }

    /**
     * Type check HAVING, ORDER BY and ranking against the query's grouping dimensions and accumulator layout.
     * @param binding HAVING phase binding
     */
    public void validate(GroupBinding binding) {

        if (having != null) {
            having.validate(binding);
        }
        for (OrderKey orderKey : orderKeys) {
            orderKey.validate(binding, ranking != null);
        }
        if (ranking != null) {
            ranking.validate(binding);
        }
    }

    /**
     * @param groups merged accumulators, read only
     * @param context checked for cancellation between phases
     * @return ordered result rows
     */
    public List<ResultRow> assemble(Map<GroupKey, Accumulator> groups, QueryContext context) {

        long enterTime = System.currentTimeMillis();
        List<ResultRow> rows = new ArrayList<ResultRow>(groups.size());
        GroupEvaluationContext evaluation = new GroupEvaluationContext(dimensions);
        for (Entry<GroupKey, Accumulator> entry : groups.entrySet()) {
            if (having != null && !having.test(evaluation.reset(entry.getKey(), entry.getValue()))) {
                continue;
            }
            rows.add(new ResultRow(dimensions, entry.getKey(), entry.getValue(), totalMarker));
        }
        context.checkCancelled("HAVING");
        LOGGER.debug("HAVING {} kept {} of {} groups.", having, rows.size(), groups.size());

        if (ranking != null) {
            rank(rows);
            context.checkCancelled("ranking");
        }

        rows.sort(new Comparator<ResultRow>() {

            @Override
            public int compare(ResultRow o1, ResultRow o2) {

                for (OrderKey orderKey : orderKeys) {
                    int compared = orderKey.compare(o1, o2);
                    if (compared != 0) {
                        return compared;
                    }
                }
                return canonicalOrder.compare(o1, o2);
            }
        });
        LOGGER.debug("Assembled {} rows ordered by {} using {} ms.", rows.size(), orderKeys,
                System.currentTimeMillis() - enterTime);
        return rows;
    }

    private void rank(List<ResultRow> rows) {

        // NTILE window is partitioned by grouping set
        Map<GroupingSet, Map<ResultRow, BigDecimal>> partitions =
                new LinkedHashMap<GroupingSet, Map<ResultRow, BigDecimal>>();
        for (ResultRow row : rows) {
            Map<ResultRow, BigDecimal> partition = partitions.get(row.getGroupingSet());
            if (partition == null) {
                partition = new LinkedHashMap<ResultRow, BigDecimal>();
                partitions.put(row.getGroupingSet(), partition);
            }
            partition.put(row, ranking.orderingValue(row));
        }
        for (Entry<GroupingSet, Map<ResultRow, BigDecimal>> e : partitions.entrySet()) {
            for (RankedEntity<ResultRow> ranked : ranking.getRanker().rank(e.getValue(), canonicalOrder)) {
                ranked.getId().setBucket(ranked.getBucket());
            }
            LOGGER.debug("Ranked {} groups of {} by {}.", e.getValue().size(), e.getKey(), ranking);
        }
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public String getTotalMarker() {
        return totalMarker;
    }

}
