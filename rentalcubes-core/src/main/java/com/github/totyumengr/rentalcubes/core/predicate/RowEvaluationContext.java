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

import com.github.totyumengr.rentalcubes.core.FactTable.Record;
import com.github.totyumengr.rentalcubes.core.SlotValue;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;

/**
 * Evaluates WHERE conditions against one row at a time. Reused for every row of a partition, not thread-safe.
 * 
 * @author mengran
 *
 */
public class RowEvaluationContext implements EvaluationContext {
    
    private Record record;
    
    public RowEvaluationContext reset(Record record) {
        this.record = record;
        return this;
    }

    @Override
    public SlotValue column(String column) {
        return SlotValue.of(record.get(column));
    }

    @Override
    public SlotValue aggregate(AggregateFunction function, String argument) {
        throw new IllegalStateException("Row has no aggregate " + function.label(argument));
    }
    
}
