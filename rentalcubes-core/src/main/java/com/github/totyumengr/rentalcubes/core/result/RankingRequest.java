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

import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.PredicateTypeException;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;
import com.github.totyumengr.rentalcubes.core.predicate.GroupBinding;
import com.github.totyumengr.rentalcubes.core.rank.Ranker;

/**
 * <code>NTILE(buckets) OVER (PARTITION BY grouping set ORDER BY aggregate DESC)</code>.
 *
 * @author mengran
 *
 */
public final class RankingRequest {

    private final AggregateFunction function;
    private final String argument;
    private final Ranker ranker;

    /**
     * @param function ordering aggregate
     * @param argument measure, distinct attribute or <code>null</code> for <code>COUNT(*)</code>
     * @param buckets bucket count
     * @throws CubeConfigurationException if buckets is less than 1
     */
    public RankingRequest(AggregateFunction function, String argument, int buckets) throws CubeConfigurationException {
        super();
        Assert.notNull(function, "Aggregate function can not be null.");
        this.function = function;
        this.argument = argument;
        this.ranker = new Ranker(buckets);
    }

    public AggregateFunction getFunction() {
        return function;
    }

    public String getArgument() {
        return argument;
    }

    public int getBuckets() {
        return ranker.getBuckets();
    }

    Ranker getRanker() {
        return ranker;
    }

    void validate(GroupBinding binding) {

        ValueType type = binding.aggregateType(function, argument);
        if (type != ValueType.NUMBER) {
            throw new PredicateTypeException("Ranking needs a number aggregate, " + function.label(argument) + " is "
                    + type);
        }
    }

    BigDecimal orderingValue(ResultRow row) {

        Object value = row.getAggregate(function, argument);
        return value == null ? null : ValueType.toBigDecimal((Number) value);
    }

    @Override
    public String toString() {
        return "NTILE(" + getBuckets() + ") ORDER BY " + function.label(argument) + " DESC";
    }

}
