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

import java.util.Arrays;

import com.github.totyumengr.rentalcubes.core.SlotValue;

/**
 * Fixed-length tuple, one slot per configured dimension. {@link SlotValue#AGGREGATED} only appears in the slots the
 * producing {@link GroupingSet} excludes.
 *
 * @author mengran
 *
 */
public final class GroupKey {

    private final SlotValue[] slots;
    private final GroupingSet groupingSet;
    private final int hash;

    GroupKey(SlotValue[] slots, GroupingSet groupingSet) {
        super();
        this.slots = slots;
        this.groupingSet = groupingSet;
        this.hash = Arrays.hashCode(slots);
    }

    public int size() {
        return slots.length;
    }

    public SlotValue getSlot(int index) {
        return slots[index];
    }

    public GroupingSet getGroupingSet() {
        return groupingSet;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    /**
     * Slots alone identify a key: grouping sets of one spec differ in their {@link SlotValue#AGGREGATED} positions.
     */
    @Override
    public boolean equals(Object obj) {

        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GroupKey)) {
            return false;
        }
        GroupKey other = (GroupKey) obj;
        return hash == other.hash && Arrays.equals(slots, other.slots);
    }

    @Override
    public String toString() {
        return Arrays.toString(slots);
    }

}
