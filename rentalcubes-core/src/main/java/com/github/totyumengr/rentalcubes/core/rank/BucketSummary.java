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
 * Members and ordering-measure total of a range of buckets, e.g. buckets 1..1 of 10 for "top 10%".
 *
 * @author mengran
 *
 */
public final class BucketSummary {

    private final int fromBucket;
    private final int toBucket;
    private final int members;
    private final int valuedMembers;
    private final BigDecimal total;
    private final BigDecimal average;

    BucketSummary(int fromBucket, int toBucket, int members, int valuedMembers, BigDecimal total,
            BigDecimal average) {
        super();
        this.fromBucket = fromBucket;
        this.toBucket = toBucket;
        this.members = members;
        this.valuedMembers = valuedMembers;
        this.total = total;
        this.average = average;
    }

    public int getFromBucket() {
        return fromBucket;
    }

    public int getToBucket() {
        return toBucket;
    }

    public int getMembers() {
        return members;
    }

    /**
     * @return members having an ordering value
     */
    public int getValuedMembers() {
        return valuedMembers;
    }

    /**
     * @return sum of ordering values, zero for an empty range
     */
    public BigDecimal getTotal() {
        return total;
    }

    /**
     * @return average ordering value, <code>null</code> if no member has a value
     */
    public BigDecimal getAverage() {
        return average;
    }

    @Override
    public String toString() {
        return "BucketSummary [buckets=" + fromBucket + ".." + toBucket + ", members=" + members + ", total=" + total
                + ", average=" + average + "]";
    }

}
