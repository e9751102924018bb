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

import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;
import com.github.totyumengr.rentalcubes.core.SlotValue;
import com.github.totyumengr.rentalcubes.core.ValueType;
import com.github.totyumengr.rentalcubes.core.aggregate.AggregateFunction;
import com.github.totyumengr.rentalcubes.core.predicate.GroupBinding;

/**
 * One ORDER BY key of a cube query: a grouping dimension, an aggregate or the bucket of a ranked query.
 *
 * <p>Concrete values follow {@link Direction}. Missing values and rolled-up slots are placed by {@link NullOrdering}:
 * with {@link NullOrdering#NULLS_LAST} the order is values, <code>NULL</code>, total; {@link NullOrdering#NULLS_FIRST}
 * reverses it to total, <code>NULL</code>, values. An aggregate without value sorts as <code>NULL</code>.
 *
 * @author mengran
 *
 */
public final class OrderKey {

    public enum Direction {
        ASC, DESC
    }

    public enum NullOrdering {
        NULLS_LAST, NULLS_FIRST
    }

    private enum Target {
        DIMENSION, AGGREGATE, BUCKET
    }

    private final Target target;
    private final AggregateFunction function;
    private final String name;
    private final Direction direction;
    private final NullOrdering nullOrdering;

    private OrderKey(Target target, AggregateFunction function, String name, Direction direction,
            NullOrdering nullOrdering) {
        super();
        Assert.notNull(direction, "Direction can not be null.");
        Assert.notNull(nullOrdering, "Null ordering can not be null.");
        this.target = target;
        this.function = function;
        this.name = name;
        this.direction = direction;
        this.nullOrdering = nullOrdering;
    }

    public static OrderKey dimension(String dimension) {
        return dimension(dimension, Direction.ASC, NullOrdering.NULLS_LAST);
    }

    public static OrderKey dimension(String dimension, Direction direction) {
        return dimension(dimension, direction, NullOrdering.NULLS_LAST);
    }

    public static OrderKey dimension(String dimension, Direction direction, NullOrdering nullOrdering) {

        Assert.hasText(dimension, "Dimension can not be empty.");
        return new OrderKey(Target.DIMENSION, null, dimension, direction, nullOrdering);
    }

    public static OrderKey aggregate(AggregateFunction function, String argument, Direction direction) {
        return aggregate(function, argument, direction, NullOrdering.NULLS_LAST);
    }

    public static OrderKey aggregate(AggregateFunction function, String argument, Direction direction,
            NullOrdering nullOrdering) {

        Assert.notNull(function, "Aggregate function can not be null.");
        return new OrderKey(Target.AGGREGATE, function, argument, direction, nullOrdering);
    }

    public static OrderKey bucket(Direction direction) {
        return new OrderKey(Target.BUCKET, null, null, direction, NullOrdering.NULLS_LAST);
    }

    /**
     * @param binding HAVING phase binding of the query
     * @param ranked whether the query carries a ranking request
     * @throws CubeConfigurationException if the key references something the query does not produce
     */
    void validate(GroupBinding binding, boolean ranked) throws CubeConfigurationException {

        switch (target) {
        case DIMENSION:
            binding.columnType(name);
            break;
        case AGGREGATE:
            binding.aggregateType(function, name);
            break;
        default:
            if (!ranked) {
                throw new CubeConfigurationException("Can not order by bucket of a query without ranking.");
            }
        }
    }

    int compare(ResultRow left, ResultRow right) {
        return compareSlots(value(left), value(right), direction, nullOrdering);
    }

    private SlotValue value(ResultRow row) {

        switch (target) {
        case DIMENSION:
            return row.getSlot(name);
        case AGGREGATE:
            return SlotValue.of(row.getAggregate(function, name));
        default:
            return SlotValue.of(row.getBucket());
        }
    }

    static int compareSlots(SlotValue left, SlotValue right, Direction direction, NullOrdering nullOrdering) {

        int l = placement(left, nullOrdering);
        int r = placement(right, nullOrdering);
        if (l != r) {
            return Integer.compare(l, r);
        }
        if (!left.isConcrete()) {
            return 0;
        }
        int compared = ValueType.compareValues(left.getValue(), right.getValue());
        return direction == Direction.DESC ? -compared : compared;
    }

    private static int placement(SlotValue value, NullOrdering nullOrdering) {

        switch (value.getKind()) {
        case VALUE:
            return nullOrdering == NullOrdering.NULLS_LAST ? 0 : 2;
        case NULL:
            return 1;
        default:
            return nullOrdering == NullOrdering.NULLS_LAST ? 2 : 0;
        }
    }

    @Override
    public String toString() {

        String label = target == Target.DIMENSION ? name : target == Target.AGGREGATE ? function.label(name)
                : ResultRow.BUCKET;
        return label + " " + direction + " " + nullOrdering;
    }

}
