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
package com.github.totyumengr.rentalcubes.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import com.github.totyumengr.rentalcubes.core.FactTable.Record;
import com.github.totyumengr.rentalcubes.core.aggregate.Accumulator;
import com.github.totyumengr.rentalcubes.core.aggregate.Aggregator;
import com.github.totyumengr.rentalcubes.core.grouping.GroupKey;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSetSpec;
import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.predicate.RowBinding;
import com.github.totyumengr.rentalcubes.core.predicate.RowEvaluationContext;
import com.github.totyumengr.rentalcubes.core.result.ResultRow;

/**
 * In-memory rental cube base on java8 stream feature. Rows are split into contiguous partitions, each aggregated into
 * its own group map, and the partial maps are merged once every partition has joined. No lock is taken while
 * aggregating.
 *
 * <p>Parallel mode runs the partitions on the common fork-join pool, sequential mode runs one partition on the caller
 * thread.
 *
 * @author mengran
 *
 */
public class RentalCube implements Aggregations {

    private static final Logger LOGGER = LoggerFactory.getLogger(RentalCube.class);

    private FactTable factTable;

    private volatile boolean parallelMode = true;

    private volatile int parallelism = Runtime.getRuntime().availableProcessors();

    public RentalCube(FactTable factTable) {
        super();
        Assert.notNull(factTable, "Fact-table can not be null.");
        this.factTable = factTable;
    }

    public FactTable getFactTable() {
        return factTable;
    }

    public boolean isParallelMode() {
        return parallelMode;
    }

    public void setParallelMode(boolean parallelMode) {
        LOGGER.info("Change parallel mode from {} to {}", this.parallelMode, parallelMode);
        this.parallelMode = parallelMode;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * @param parallelism row partitions used in parallel mode
     */
    public void setParallelism(int parallelism) {
        Assert.isTrue(parallelism > 0, "Parallelism must be positive.");
        this.parallelism = parallelism;
    }

    /**
     * @param merge cube whose records are merged into this one, same fact-table layout required
     */
    public void merge(RentalCube merge) {

        Assert.notNull(merge, "Merged cube can not be null.");
        factTable.merge(merge.factTable);
    }

    // ---------------------------- Aggregation API ----------------------------

    @Override
    public List<ResultRow> query(CubeQuery query) {
        return query(query, new QueryContext());
    }

    @Override
    public List<ResultRow> query(CubeQuery query, QueryContext context) {

        Assert.notNull(query, "Query can not be null.");
        Assert.notNull(context, "Query context can not be null.");
        if (!factTable.getMeta().sameLayout(query.getMeta())) {
            throw new CubeConfigurationException("Query is prepared for " + query.getMeta() + " but cube is "
                    + factTable.getMeta());
        }
        context.checkCancelled("setup");

        StopWatch stopWatch = new StopWatch(query.getGroupingSpec().toString());
        stopWatch.start("aggregate");
        Aggregator aggregator = new Aggregator(factTable, query.getGroupingSpec(), query.getLayout(),
                query.getWhere());
        List<List<Record>> partitions = partition(factTable.getRecords(), parallelMode ? parallelism : 1);
        Stream<List<Record>> stream = parallelMode ? partitions.parallelStream() : partitions.stream();
        List<Map<GroupKey, Accumulator>> partials = stream
                .map(new Function<List<Record>, Map<GroupKey, Accumulator>>() {

                    @Override
                    public Map<GroupKey, Accumulator> apply(List<Record> t) {
                        return aggregator.aggregate(t, context);
                    }
                }).collect(Collectors.toList());
        stopWatch.stop();

        stopWatch.start("merge");
        Map<GroupKey, Accumulator> merged = Aggregator.merge(partials);
        aggregator.seedGrandTotals(merged);
        context.checkCancelled("merge");
        stopWatch.stop();

        stopWatch.start("assemble");
        List<ResultRow> rows = query.getAssembler().assemble(merged, context);
        stopWatch.stop();

        LOGGER.info("Query {} on {} partitions result {} rows from {} groups using {} ms.", query, partitions.size(),
                rows.size(), merged.size(), stopWatch.getTotalTimeMillis());
        LOGGER.debug(stopWatch.prettyPrint());
        return rows;
    }

    private static List<List<Record>> partition(List<Record> records, int count) {

        int size = Math.max(1, (records.size() + count - 1) / count);
        List<List<Record>> partitions = new ArrayList<List<Record>>(count);
        for (int from = 0; from < records.size(); from += size) {
            partitions.add(records.subList(from, Math.min(records.size(), from + size)));
        }
        if (partitions.isEmpty()) {
            partitions.add(records);
        }
        return partitions;
    }

    /**
     * Sum calculation of given indicate. It equal to "SELECT SUM({indName}) FROM {fact table of cube}".
     * @param indName indicate name for sum
     * @return result that formated using {@value #IND_SCALE}
     */
    @Override
    public BigDecimal sum(String indName) {

        // Delegate to overload method
        return sum(indName, (Condition) null);
    }

    @Override
    public BigDecimal sum(String indName, Condition where) {

        long enterTime = System.currentTimeMillis();
        int index = numberIndex(indName);
        if (where != null) {
            where.validate(new RowBinding(factTable.getMeta()));
        }

        List<Record> records = factTable.getRecords();
        Stream<Record> stream = parallelMode ? records.parallelStream() : records.stream();
        BigDecimal sum = stream.filter(r -> where == null || where.test(new RowEvaluationContext().reset(r)))
                .map(r -> r.getInd(index)).filter(v -> v != null).map(v -> ValueType.toBigDecimal((Number) v))
                .reduce(BigDecimal.ZERO, (x, y) -> x.add(y)).setScale(IND_SCALE, RoundingMode.HALF_UP);
        LOGGER.info("Sum {} filter {} result {} using {} ms.", indName, where, sum,
                System.currentTimeMillis() - enterTime);

        return sum;
    }

    @Override
    public Map<Object, BigDecimal> sum(String indName, String groupByDimName, Condition where) {

        long enterTime = System.currentTimeMillis();
        numberIndex(indName);
        CubeQuery query = new CubeQuery.CubeQueryBuilder(factTable.getMeta())
                .groupBy(GroupingSetSpec.groupBy(groupByDimName)).measures(indName).where(where).done();

        Map<Object, BigDecimal> group = new LinkedHashMap<Object, BigDecimal>();
        for (ResultRow row : query(query)) {
            BigDecimal sum = row.getSum(indName);
            group.put(row.getSlot(groupByDimName).getValue(),
                    (sum == null ? BigDecimal.ZERO : sum).setScale(IND_SCALE, RoundingMode.HALF_UP));
        }
        LOGGER.info("Group by {} sum {} filter {} result {} using {} ms.", groupByDimName, indName, where, group,
                System.currentTimeMillis() - enterTime);
        return group;
    }

    private int numberIndex(String indName) {

        int index = factTable.getIndIndex(indName);
        if (factTable.getMeta().getType(indName) != ValueType.NUMBER) {
            throw new PredicateTypeException("SUM needs a number measure, " + indName + " is "
                    + factTable.getMeta().getType(indName));
        }
        return index;
    }

    @Override
    public String toString() {
        return "RentalCube [factTable=" + factTable + "]";
    }

}
