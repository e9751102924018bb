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
package com.github.totyumengr.rentalcubes.core.rank;

import java.math.BigDecimal;

/**
 * One ranked entity: its position in descending order and the quantile bucket it falls in.
 *
 * @author mengran
 *
 * @param <K> entity id type
 */
public final class RankedEntity<K> {

    private final K id;
    private final BigDecimal value;
    private final int position;
    private final int bucket;

    RankedEntity(K id, BigDecimal value, int position, int bucket) {
        super();
        this.id = id;
        this.value = value;
        this.position = position;
        this.bucket = bucket;
    }

    public K getId() {
        return id;
    }

    /**
     * @return ordering measure, <code>null</code> if the entity has no value
     */
    public BigDecimal getValue() {
        return value;
    }

    /**
     * @return zero based position in ranking order
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return bucket number, 1 holds the highest ranked entities
     */
    public int getBucket() {
        return bucket;
    }

    @Override
    public String toString() {
        return "RankedEntity [id=" + id + ", value=" + value + ", bucket=" + bucket + "]";
    }

}
