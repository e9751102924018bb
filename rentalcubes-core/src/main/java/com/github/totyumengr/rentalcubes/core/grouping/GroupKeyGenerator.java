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
package com.github.totyumengr.rentalcubes.core.grouping;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.SlotValue;

/**
 * Row replication for CUBE/ROLLUP/GROUPING SETS: one input row yields one {@link GroupKey} per grouping set. Keys are
 * produced lazily, so the replicas of a row are never held in memory all at once.
 *
 * @author mengran
 *
 */
public class GroupKeyGenerator {

    private final List<GroupingSet> groupingSets;
    private final int dimensionCount;

    public GroupKeyGenerator(GroupingSetSpec spec) {
        super();
        this.groupingSets = spec.getGroupingSets();
        this.dimensionCount = spec.getDimensions().size();
    }

    public int getReplicationFactor() {
        return groupingSets.size();
    }

    /**
     * @return keys of the grouping sets that group by nothing, present even when no row is aggregated
     */
    public List<GroupKey> grandTotalKeys() {

        List<GroupKey> keys = new ArrayList<GroupKey>(1);
        Object[] noValues = new Object[dimensionCount];
        for (GroupingSet groupingSet : groupingSets) {
            if (groupingSet.isGrandTotal()) {
                keys.add(keyOf(noValues, groupingSet));
            }
        }
        return keys;
    }

    /**
     * @param dimValues values of the configured dimensions for one row, in configured order. <code>null</code> elements
     *      are natural missing values.
     * @return restartable, finite sequence of keys in grouping set order
     */
    public Iterable<GroupKey> replicate(Object[] dimValues) {

        Assert.isTrue(dimValues.length == dimensionCount, "Expect " + dimensionCount + " dimension values.");
        return new Iterable<GroupKey>() {

            @Override
            public Iterator<GroupKey> iterator() {
                return new Iterator<GroupKey>() {

                    private int next = 0;

                    @Override
                    public boolean hasNext() {
                        return next < groupingSets.size();
                    }

                    @Override
                    public GroupKey next() {

                        if (!hasNext()) {
                            throw new NoSuchElementException();
                        }
                        return keyOf(dimValues, groupingSets.get(next++));
                    }
                };
            }
        };
    }

    /**
     * @param dimValues values of the configured dimensions
     * @param groupingSet one of the generator's grouping sets
     * @return key with excluded slots masked as {@link SlotValue#AGGREGATED}
     */
    public GroupKey keyOf(Object[] dimValues, GroupingSet groupingSet) {

        SlotValue[] slots = new SlotValue[dimensionCount];
        for (int i = 0; i < dimensionCount; i++) {
            slots[i] = groupingSet.contains(i) ? SlotValue.of(dimValues[i]) : SlotValue.AGGREGATED;
        }
        return new GroupKey(slots, groupingSet);
    }

}
