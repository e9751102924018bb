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
package com.github.totyumengr.rentalcubes.core.aggregate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.totyumengr.rentalcubes.core.FactTable;
import com.github.totyumengr.rentalcubes.core.FactTable.Record;
import com.github.totyumengr.rentalcubes.core.PredicateTypeException;
import com.github.totyumengr.rentalcubes.core.QueryContext;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.grouping.GroupKey;
import com.github.totyumengr.rentalcubes.core.grouping.GroupKeyGenerator;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSetSpec;
import com.github.totyumengr.rentalcubes.core.predicate.Condition;
import com.github.totyumengr.rentalcubes.core.predicate.RowEvaluationContext;

/**
 * Streams rows into a map from {@link GroupKey} to {@link Accumulator}. Every row passing the WHERE condition is
 * replicated once per grouping set, so one pass costs O(rows x grouping sets).
 *
 * <p>{@link #aggregate(List, QueryContext)} builds a partial map owned by the calling worker, no locking involved.
 * {@link #merge(List)} combines partial maps after all workers have joined.
 *
 * @author mengran
 *
 */
public class Aggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

    private final GroupKeyGenerator generator;
    private final AccumulatorLayout layout;
    private final Condition where;

    private final int[] dimIndexes;
    private final int[] indIndexes;
    /**
     * Distinct attributes may be dimensions or measures: non-negative index is a dimension, -(index + 1) a measure.
     */
    private final int[] distinctIndexes;

    public Aggregator(FactTable factTable, GroupingSetSpec spec, AccumulatorLayout layout, Condition where) {
        super();
        this.generator = new GroupKeyGenerator(spec);
        this.layout = layout;
        this.where = where;

        List<String> dims = spec.getDimensions();
        this.dimIndexes = new int[dims.size()];
        for (int i = 0; i < dims.size(); i++) {
            dimIndexes[i] = factTable.getDimIndex(dims.get(i));
        }
        List<String> measures = layout.getMeasures();
        this.indIndexes = new int[measures.size()];
        for (int i = 0; i < measures.size(); i++) {
            indIndexes[i] = factTable.getIndIndex(measures.get(i));
        }
        List<String> distincts = layout.getDistinctAttributes();
        this.distinctIndexes = new int[distincts.size()];
        for (int i = 0; i < distincts.size(); i++) {
            String attribute = distincts.get(i);
            distinctIndexes[i] = factTable.getMeta().isDim(attribute) ? factTable.getDimIndex(attribute)
                    : -(factTable.getIndIndex(attribute) + 1);
        }
    }

    public AccumulatorLayout getLayout() {
        return layout;
    }

    /**
     * Partial aggregation of one row partition.
     * @param rows partition rows
     * @param context checked for cancellation between batches
     * @return partial map, owned by the caller
     */
    public Map<GroupKey, Accumulator> aggregate(List<Record> rows, QueryContext context) {

        long enterTime = System.currentTimeMillis();
        Map<GroupKey, Accumulator> partial = new HashMap<GroupKey, Accumulator>();
        RowEvaluationContext evaluation = new RowEvaluationContext();
        int batchSize = context.getBatchSize();
        int filtered = 0;

        for (int i = 0; i < rows.size(); i++) {
            if (i % batchSize == 0) {
                context.checkCancelled("partial aggregation");
            }
            Record record = rows.get(i);
            if (where != null && !where.test(evaluation.reset(record))) {
                continue;
            }
            filtered++;
            accumulate(partial, record);
        }
        context.checkCancelled("partial aggregation");

        LOGGER.debug("Partial aggregation of {} rows, {} passed filter, into {} groups using {} ms.", rows.size(),
                filtered, partial.size(), System.currentTimeMillis() - enterTime);
        return partial;
    }

    private void accumulate(Map<GroupKey, Accumulator> partial, Record record) {

        Object[] dimValues = new Object[dimIndexes.length];
        for (int i = 0; i < dimIndexes.length; i++) {
            dimValues[i] = record.getDim(dimIndexes[i]);
        }
        Object[] measureValues = new Object[indIndexes.length];
        for (int i = 0; i < indIndexes.length; i++) {
            measureValues[i] = record.getInd(indIndexes[i]);
        }
        Integer[] distinctValues = new Integer[distinctIndexes.length];
        for (int i = 0; i < distinctIndexes.length; i++) {
            int index = distinctIndexes[i];
            Object value = index >= 0 ? record.getDim(index) : record.getInd(-index - 1);
            distinctValues[i] = value == null ? null : toIntExact(i, (Number) value);
        }

        for (GroupKey key : generator.replicate(dimValues)) {
            Accumulator accumulator = partial.get(key);
            if (accumulator == null) {
                accumulator = new Accumulator(layout);
                partial.put(key, accumulator);
            }
            accumulator.update(measureValues, distinctValues);
        }
    }

    private Integer toIntExact(int distinctIndex, Number number) {

        Integer value = ValueType.toInteger(number);
        if (value == null) {
            throw new PredicateTypeException("Distinct count needs integer values, "
                    + layout.getDistinctAttributes().get(distinctIndex) + " has " + number);
        }
        return value;
    }

    /**
     * Add an empty accumulator for every grand-total key missing from the merged map, so CUBE and ROLLUP keep their
     * total row over an empty input.
     * @param merged merged map, updated in place
     */
    public void seedGrandTotals(Map<GroupKey, Accumulator> merged) {

        for (GroupKey key : generator.grandTotalKeys()) {
            if (!merged.containsKey(key)) {
                LOGGER.debug("No row reached grand total {}, seed an empty group.", key.getGroupingSet());
                merged.put(key, new Accumulator(layout));
            }
        }
    }

    /**
     * Combine partial maps. Partial accumulators are consumed: the first map and its accumulators become the result.
     * @param partials partial maps of joined workers
     * @return merged map
     */
    public static Map<GroupKey, Accumulator> merge(List<Map<GroupKey, Accumulator>> partials) {

        if (partials.isEmpty()) {
            return new HashMap<GroupKey, Accumulator>(0);
        }
        Map<GroupKey, Accumulator> merged = partials.get(0);
        for (int i = 1; i < partials.size(); i++) {
            for (Entry<GroupKey, Accumulator> entry : partials.get(i).entrySet()) {
                Accumulator existing = merged.get(entry.getKey());
                if (existing == null) {
                    merged.put(entry.getKey(), entry.getValue());
                } else {
                    existing.merge(entry.getValue());
                }
            }
        }
        return merged;
    }

}
