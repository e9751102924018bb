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
package com.github.totyumengr.rentalcubes.core.predicate;

import java.util.List;

import com.github.totyumengr.rentalcubes.core.SlotValue;
import com.github.totyumengr.rentalcubes.core.aggregate.Accumulator;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;
import com.github.totyumengr.rentalcubes.core.grouping.GroupKey;

/**
 * Evaluates HAVING conditions against a finished group. Reads the accumulator only, never changes it.
 * 
 * @author mengran
 *
 */
public class GroupEvaluationContext implements EvaluationContext {
    
    private final List<String> dimensions;
    private GroupKey key;
    private Accumulator accumulator;
    
    public GroupEvaluationContext(List<String> dimensions) {
        super();
        this.dimensions = dimensions;
    }
    
    public GroupEvaluationContext reset(GroupKey key, Accumulator accumulator) {
        this.key = key;
        this.accumulator = accumulator;
        return this;
    }

    @Override
    public SlotValue column(String column) {
        
        int index = dimensions.indexOf(column);
        if (index < 0) {
            throw new IllegalStateException("Column " + column + " is not a grouping dimension of " + dimensions);
        }
        return key.getSlot(index);
    }

    @Override
    public SlotValue aggregate(AggregateFunction function, String argument) {
        return SlotValue.of(accumulator.value(function, argument));
    }
    
}
