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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.github.totyumengr.rentalcubes.core.SlotValue;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.aggregate.Accumulator;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;
import com.github.totyumengr.rentalcubes.core.grouping.GroupKey;
import com.github.totyumengr.rentalcubes.core.grouping.GroupingSet;

/**
 * One output row of a cube query: the group key, its aggregates and, for ranked queries, its bucket.
 *
 * <p>Slots keep their three states. Only {@link #getDisplayValue(String)} and {@link #toDisplayMap()} collapse
 * {@link SlotValue#AGGREGATED} into the total marker.
 *
 * @author mengran
 *
 */
public final class ResultRow {

    public static final String GROUPING_ID = "GROUPING_ID";
    public static final String BUCKET = "NTILE";

    private final List<String> dimensions;
    private final GroupKey key;
    private final Accumulator accumulator;
    private final String totalMarker;
    private Integer bucket;

    ResultRow(List<String> dimensions, GroupKey key, Accumulator accumulator, String totalMarker) {
        super();
        this.dimensions = dimensions;
        this.key = key;
        this.accumulator = accumulator;
        this.totalMarker = totalMarker;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public GroupKey getKey() {
        return key;
    }

    public GroupingSet getGroupingSet() {
        return key.getGroupingSet();
    }

    public int getGroupingId() {
        return key.getGroupingSet().getGroupingId();
    }

    public SlotValue getSlot(String dimension) {

        int index = dimensions.indexOf(dimension);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown dimension " + dimension + " of " + dimensions);
        }
        return key.getSlot(index);
    }

    /**
     * @param dimension grouping dimension
     * @return value, <code>null</code> for a natural missing value or the total marker for a rolled-up slot
     */
    public Object getDisplayValue(String dimension) {
        return getSlot(dimension).display(totalMarker);
    }

    /**
     * SQL <code>GROUPING(dimension)</code>.
     */
    public boolean isTotal(String dimension) {
        return getSlot(dimension).isAggregated();
    }

    public boolean isGrandTotal() {
        return key.getGroupingSet().isGrandTotal();
    }

    public long getCount() {
        return accumulator.getCount();
    }

    public long getCount(String measure) {
        return accumulator.getCount(measure);
    }

    /**
     * @param function aggregate function
     * @param argument measure, distinct attribute or <code>null</code>
     * @return aggregate value, <code>null</code> means "no value"
     */
    public Object getAggregate(AggregateFunction function, String argument) {
        return accumulator.value(function, argument);
    }

    public BigDecimal getSum(String measure) {
        return accumulator.getSum(measure);
    }

    public BigDecimal getAvg(String measure) {
        return accumulator.getAvg(measure);
    }

    public Object getMin(String measure) {
        return accumulator.getMin(measure);
    }

    public Object getMax(String measure) {
        return accumulator.getMax(measure);
    }

    public long getDistinctCount(String attribute) {
        return accumulator.getDistinctCount(attribute);
    }

    /**
     * @return bucket number or <code>null</code> if the query is not ranked
     */
    public Integer getBucket() {
        return bucket;
    }

    void setBucket(Integer bucket) {
        this.bucket = bucket;
    }

    /**
     * Flat display form: grouping dimensions, <code>GROUPING_ID</code>, <code>COUNT(*)</code>, the aggregates of every
     * tracked measure and distinct attribute, then the bucket if ranked.
     * @return ordered column label to display value
     */
    public Map<String, Object> toDisplayMap() {

        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for (String dimension : dimensions) {
            map.put(dimension, getDisplayValue(dimension));
        }
        map.put(GROUPING_ID, getGroupingId());
        map.put(AggregateFunction.COUNT.label(null), getCount());
        for (int i = 0; i < accumulator.getLayout().getMeasures().size(); i++) {
            String measure = accumulator.getLayout().getMeasures().get(i);
            map.put(AggregateFunction.COUNT.label(measure), getCount(measure));
            if (accumulator.getLayout().getMeasureType(i) == ValueType.NUMBER) {
                map.put(AggregateFunction.SUM.label(measure), getSum(measure));
                map.put(AggregateFunction.AVG.label(measure), getAvg(measure));
            }
            map.put(AggregateFunction.MIN.label(measure), getMin(measure));
            map.put(AggregateFunction.MAX.label(measure), getMax(measure));
        }
        for (String attribute : accumulator.getLayout().getDistinctAttributes()) {
            map.put(AggregateFunction.COUNT_DISTINCT.label(attribute), getDistinctCount(attribute));
        }
        if (bucket != null) {
            map.put(BUCKET, bucket);
        }
        return map;
    }

    @Override
    public String toString() {
        return "ResultRow [key=" + key + ", count=" + getCount() + (bucket == null ? "" : ", bucket=" + bucket) + "]";
    }

}
