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
package com.github.totyumengr.rentalcubes.core;

/**
 * Three-state value of one dimension slot: a concrete value, the natural missing value of the domain or the
 * {@link #AGGREGATED} marker of a slot that was rolled up by its grouping set.
 *
 * <p>{@link #NULL} and {@link #AGGREGATED} are never equal, so a group with a natural <code>NULL</code> country and the
 * country subtotal are different groups.
 *
 * @author mengran
 *
 */
public final class SlotValue {

    public enum Kind {
        VALUE, NULL, AGGREGATED
    }

    public static final SlotValue NULL = new SlotValue(Kind.NULL, null);

    public static final SlotValue AGGREGATED = new SlotValue(Kind.AGGREGATED, null);

    private final Kind kind;
    private final Object value;

    private SlotValue(Kind kind, Object value) {
        super();
        this.kind = kind;
        this.value = value;
    }

    /**
     * @param value concrete value, <code>null</code> means {@link #NULL}
     * @return slot value
     */
    public static SlotValue of(Object value) {
        return value == null ? NULL : new SlotValue(Kind.VALUE, value);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return concrete value, <code>null</code> for {@link #NULL} and {@link #AGGREGATED}
     */
    public Object getValue() {
        return value;
    }

    public boolean isConcrete() {
        return kind == Kind.VALUE;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isAggregated() {
        return kind == Kind.AGGREGATED;
    }

    /**
     * Collapse to two states for display.
     * @param totalMarker substituted for {@link #AGGREGATED}
     * @return display value
     */
    public Object display(Object totalMarker) {
        return isAggregated() ? totalMarker : value;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + (value == null ? 0 : value.hashCode());
    }

    @Override
    public boolean equals(Object obj) {

        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SlotValue)) {
            return false;
        }
        SlotValue other = (SlotValue) obj;
        return kind == other.kind && (value == null ? other.value == null : value.equals(other.value));
    }

    @Override
    public String toString() {
        return isConcrete() ? String.valueOf(value) : kind.name();
    }

}
