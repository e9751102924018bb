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

import com.github.totyumengr.rentalcubes.core.SlotValue;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;

/**
 * What a {@link Condition} is evaluated against: a raw row (WHERE) or a group snapshot (HAVING).
 * 
 * @author mengran
 *
 */
public interface EvaluationContext {
    
    /**
     * @param column column name
     * @return column value of the row, or grouped slot of the group
     */
    SlotValue column(String column);
    
    /**
     * @param function aggregate function
     * @param argument measure, distinct attribute or <code>null</code> for <code>COUNT(*)</code>
     * @return aggregate value, {@link SlotValue#NULL} when there is no value
     */
    SlotValue aggregate(AggregateFunction function, String argument);
}
