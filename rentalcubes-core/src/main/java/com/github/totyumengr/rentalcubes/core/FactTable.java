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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

/**
 * Fact table object of <a href="http://en.wikipedia.org/wiki/Star_schema">Star Schema</a>. It holds the denormalized
 * rental rows (fact attributes plus joined dimension attributes) and serves them as the row source of
 * {@link RentalCube}.
 *
 * @author mengran
 *
 */
public class FactTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(FactTable.class);

    Meta meta;

    /**
     * Keyed by primary key, kept in insertion order so repeated queries stream rows identically.
     */
    private Map<Integer, Record> records;

    /**
     * Protect fact-table merge action.
     */
    private ReadWriteLock readWriteLock = new ReentrantReadWriteLock();

    /**
     * Column layout. Dimensions are grouped by, measures (indicators) are aggregated.
     */
    public static class Meta {

        String name;
        private LinkedHashMap<String, Integer> indColumnNames = new LinkedHashMap<String, Integer>();
        private LinkedHashMap<String, Integer> dimColumnNames = new LinkedHashMap<String, Integer>();
        private Map<String, ValueType> columnTypes = new HashMap<String, ValueType>();
        private Set<String> nullableIndColumns = new HashSet<String>();
        /**
         * Number columns whose values all fit an int, the only ones a distinct count accepts.
         */
        private Set<String> integerColumns = new HashSet<String>();

        public String getName() {
            return name;
        }

        public List<String> getDimNames() {
            return Collections.unmodifiableList(new ArrayList<String>(dimColumnNames.keySet()));
        }

        public List<String> getIndNames() {
            return Collections.unmodifiableList(new ArrayList<String>(indColumnNames.keySet()));
        }

        public boolean isDim(String name) {
            return dimColumnNames.containsKey(name);
        }

        public boolean isInd(String name) {
            return indColumnNames.containsKey(name);
        }

        public boolean hasColumn(String name) {
            return isDim(name) || isInd(name);
        }

        /**
         * @param name column name
         * @return declared domain
         * @throws CubeConfigurationException if there is no such column
         */
        public ValueType getType(String name) throws CubeConfigurationException {

            ValueType type = columnTypes.get(name);
            if (type == null) {
                throw new CubeConfigurationException("Unknown column " + name + " of fact-table " + this.name);
            }
            return type;
        }

        public boolean isNullable(String indName) {
            return nullableIndColumns.contains(indName);
        }

        /**
         * @param name column name
         * @return <code>true</code> if every value of this number column is a whole number in int range
         */
        public boolean isInteger(String name) {
            return integerColumns.contains(name);
        }

        boolean sameLayout(Meta other) {
            return dimColumnNames.equals(other.dimColumnNames) && indColumnNames.equals(other.indColumnNames)
                    && columnTypes.equals(other.columnTypes);
        }

        @Override
        public String toString() {
            return "Meta [name=" + name + ", indicator columnNames=" + indColumnNames
                    + ", dimension columnNames=" + dimColumnNames + "]";
        }
    }

    /**
     * Holding detail data, streaming calculation target object. Immutable once {@link FactTableBuilder#done()} returns.
     * @author mengran
     *
     */
    public class Record {

        private int id;     // Equal to PK.

        private Object[] indOfFact = null;

        private Object[] dimOfFact = null;

        private Record(Integer id) {
            super();
            this.id = id;
        }

        public int getId() {
            return id;
        }

        public Object getInd(String indName) {

            int index = FactTable.this.getIndIndex(indName);
            return indOfFact[index];
        }

        public Object getInd(int index) {
            return indOfFact[index];
        }

        public Object getDim(String dimName) {

            final int index = FactTable.this.getDimIndex(dimName);
            return dimOfFact[index];
        }

        public Object getDim(int index) {
            return dimOfFact[index];
        }

        /**
         * @param columnName dimension or measure name
         * @return column value, may be <code>null</code>
         */
        public Object get(String columnName) {
            return meta.isDim(columnName) ? getDim(columnName) : getInd(columnName);
        }

        @Override
        public String toString() {
            return "Record [id=" + id + ", dims=" + Arrays.toString(dimOfFact) + ", inds=" + Arrays.toString(indOfFact)
                    + "]";
        }

    }

    private FactTable(String name) {
        // Internal
        Meta meta = new Meta();
        meta.name = name;
        Assert.hasText(name, "Fact-table name can not empty.");

        this.meta = meta;
        this.records = new LinkedHashMap<Integer, FactTable.Record>();
    }

    /**
     * Builder pattern class for {@link FactTable}, chain model begin with {@link #build(String)}
     * and end with {@link #done()}.
     *
     * @author mengran
     *
     */
    public static class FactTableBuilder {

        private static List<DerivedDimensionProvider> providers = new ArrayList<DerivedDimensionProvider>();

        static {
            ServiceLoader<DerivedDimensionProvider> serviceLoader = ServiceLoader.load(DerivedDimensionProvider.class);
            for (Iterator<DerivedDimensionProvider> it = serviceLoader.iterator(); it.hasNext();) {
                providers.add(it.next());
            }
            Collections.sort(providers, new Comparator<DerivedDimensionProvider>() {

                @Override
                public int compare(DerivedDimensionProvider o1, DerivedDimensionProvider o2) {
                    return Integer.compare(o1.getOrder(), o2.getOrder());
                }
            });
            LOGGER.info("Retrieve derived dimension providers {}", providers);
        }

        private FactTable current;

        public FactTableBuilder build(String name) {

            if (current != null) {
                throw new IllegalStateException("Previous building " + current + " is doing, call #done to finish it.");
            }
            current = new FactTable(name);
            return this;
        }

        private FactTable current() {

            if (current == null) {
                throw new IllegalStateException("Current building is not started, call #build first.");
            }
            return current;
        }

        public FactTableBuilder addDimColumn(String dimColumnName, ValueType type) {

            FactTable current = current();
            Assert.notNull(type, "Dimension type can not be null.");
            if (current.meta.hasColumn(dimColumnName)) {
                throw new IllegalStateException("Column " + dimColumnName + " has exists.");
            }
            if (!current.records.isEmpty()) {
                throw new IllegalStateException("Columns must be declared before data filling.");
            }
            current.meta.dimColumnNames.put(dimColumnName, current.meta.dimColumnNames.size());
            current.meta.columnTypes.put(dimColumnName, type);
            return this;
        }

        public FactTableBuilder addDimColumns(List<String> dimColumnNames, ValueType type) {

            for (String dimColumnName : dimColumnNames) {
                addDimColumn(dimColumnName, type);
            }
            return this;
        }

        public FactTableBuilder addIndColumn(String indColumnName, ValueType type, boolean nullable) {

            FactTable current = current();
            Assert.notNull(type, "Measure type can not be null.");
            if (type == ValueType.TEXT) {
                throw new IllegalArgumentException("Measure " + indColumnName + " must be a number or a date.");
            }
            if (current.meta.hasColumn(indColumnName)) {
                throw new IllegalStateException("Column " + indColumnName + " has exists.");
            }
            if (!current.records.isEmpty()) {
                throw new IllegalStateException("Columns must be declared before data filling.");
            }
            current.meta.indColumnNames.put(indColumnName, current.meta.indColumnNames.size());
            current.meta.columnTypes.put(indColumnName, type);
            if (nullable) {
                current.meta.nullableIndColumns.add(indColumnName);
            }
            return this;
        }

        public FactTableBuilder addDimDatas(Integer primaryKey, List<?> dimDatas) {

            FactTable current = current();
            Assert.isTrue(current.meta.dimColumnNames.size() > 0, "Fact-table must have a dimension column at least.");
            Assert.isTrue(dimDatas.size() == current.meta.dimColumnNames.size(),
                    "Expect " + current.meta.dimColumnNames.size() + " dimension values but " + dimDatas.size());

            Record record = record(current, primaryKey);
            Object[] dimOfFact = new Object[dimDatas.size()];
            int i = 0;
            for (String dimColumn : current.meta.dimColumnNames.keySet()) {
                dimOfFact[i] = dimValue(current, dimColumn, dimDatas.get(i));
                i++;
            }
            record.dimOfFact = dimOfFact;

            return this;
        }

        public FactTableBuilder addIndDatas(Integer primaryKey, List<?> indDatas) {

            FactTable current = current();
            Assert.isTrue(indDatas.size() == current.meta.indColumnNames.size(),
                    "Expect " + current.meta.indColumnNames.size() + " measure values but " + indDatas.size());

            Record record = record(current, primaryKey);
            Object[] indOfFact = new Object[indDatas.size()];
            int i = 0;
            for (String indColumn : current.meta.indColumnNames.keySet()) {
                Object value = indDatas.get(i);
                if (value == null && !current.meta.isNullable(indColumn)) {
                    throw new IllegalArgumentException("Measure " + indColumn + " of record " + primaryKey
                            + " can not be null.");
                }
                indOfFact[i++] = checkValue(current, indColumn, value);
            }
            record.indOfFact = indOfFact;

            return this;
        }

        public FactTableBuilder addRecord(Integer primaryKey, List<?> dimDatas, List<?> indDatas) {
            return addDimDatas(primaryKey, dimDatas).addIndDatas(primaryKey, indDatas);
        }

        private Record record(FactTable current, Integer primaryKey) {

            Assert.notNull(primaryKey, "Primary key can not be null.");
            Record record = current.records.get(primaryKey);
            if (record == null) {
                record = current.new Record(primaryKey);
                current.records.put(primaryKey, record);
            }
            return record;
        }

        /**
         * Numbers are grouped by value, so 1, 1L and 1.00 end in the same group.
         */
        private Object dimValue(FactTable current, String column, Object value) {

            Object checked = checkValue(current, column, value);
            return checked instanceof Number ? ValueType.canonical((Number) checked) : checked;
        }

        private Object checkValue(FactTable current, String column, Object value) {

            ValueType type = current.meta.columnTypes.get(column);
            if (value != null && !type.accepts(value)) {
                throw new IllegalArgumentException("Value " + value + " of " + value.getClass().getSimpleName()
                        + " is not a " + type + " for column " + column);
            }
            return value;
        }

        public FactTable done() {

            FactTable current = current();
            this.current = null;

            Set<String> allNames = new HashSet<String>();
            allNames.addAll(current.meta.dimColumnNames.keySet());
            allNames.addAll(current.meta.indColumnNames.keySet());
            Assert.isTrue(allNames.size() == current.meta.dimColumnNames.size() + current.meta.indColumnNames.size(),
                    "Contains same name between dimentions and indicators.");

            for (Record record : current.records.values()) {
                if (record.dimOfFact == null) {
                    throw new IllegalStateException(record + " does not have dimension data.");
                }
                if (record.indOfFact == null) {
                    if (!current.meta.indColumnNames.isEmpty()) {
                        throw new IllegalStateException(record + " does not have measure data.");
                    }
                    record.indOfFact = new Object[0];
                }
            }

            fillDerivedDimensions(current);
            collectIntegerColumns(current);

            LOGGER.info("Build completed: name {} with {} dimension columns, {} measure columns and {} records.",
                    current.meta.name, current.meta.dimColumnNames.size(), current.meta.indColumnNames.size(),
                    current.records.size());

            return current;
        }

        private void fillDerivedDimensions(FactTable current) {

            LinkedHashMap<String, DerivedDimension> derived = new LinkedHashMap<String, DerivedDimension>();
            for (DerivedDimensionProvider p : providers) {
                for (Entry<String, DerivedDimension> e : p.getDerivedDimensionConfig().entrySet()) {
                    if (current.meta.hasColumn(e.getKey()) || derived.containsKey(e.getKey())) {
                        LOGGER.debug("Skip derived column {}, name has been used.", e.getKey());
                        continue;
                    }
                    // Sources may be earlier derived columns, they are filled in registration order
                    if (!e.getValue().getSourceColumns().stream()
                            .allMatch(c -> current.meta.hasColumn(c) || derived.containsKey(c))) {
                        LOGGER.debug("Skip derived column {}, missing source columns {}.", e.getKey(),
                                e.getValue().getSourceColumns());
                        continue;
                    }
                    derived.put(e.getKey(), e.getValue());
                }
            }
            if (derived.isEmpty()) {
                return;
            }

            int base = current.meta.dimColumnNames.size();
            for (Entry<String, DerivedDimension> e : derived.entrySet()) {
                current.meta.dimColumnNames.put(e.getKey(), current.meta.dimColumnNames.size());
                current.meta.columnTypes.put(e.getKey(), e.getValue().getType());
            }
            for (Record record : current.records.values()) {
                record.dimOfFact = Arrays.copyOf(record.dimOfFact, base + derived.size());
                int i = base;
                for (Entry<String, DerivedDimension> e : derived.entrySet()) {
                    List<Object> sourceValues = new ArrayList<Object>(e.getValue().getSourceColumns().size());
                    for (String source : e.getValue().getSourceColumns()) {
                        sourceValues.add(record.get(source));
                    }
                    record.dimOfFact[i++] = dimValue(current, e.getKey(), e.getValue().derive(sourceValues));
                }
            }
            LOGGER.info("Complete filling derived dimensions {} and now dimension columns is {}", derived.keySet(),
                    current.meta.dimColumnNames.keySet());
        }

        private void collectIntegerColumns(FactTable current) {

            for (Entry<String, ValueType> e : current.meta.columnTypes.entrySet()) {
                if (e.getValue() != ValueType.NUMBER) {
                    continue;
                }
                String column = e.getKey();
                boolean integer = true;
                for (Record record : current.records.values()) {
                    Object value = record.get(column);
                    if (value != null && ValueType.toInteger((Number) value) == null) {
                        integer = false;
                        break;
                    }
                }
                if (integer) {
                    current.meta.integerColumns.add(column);
                }
            }
            LOGGER.debug("Integer columns of {} are {}", current.meta.name, current.meta.integerColumns);
        }
    }

    public Meta getMeta() {
        return meta;
    }

    /**
     * @return snapshot of records in insertion order
     */
    public List<Record> getRecords() {

        readWriteLock.readLock().lock();
        try {
            return new ArrayList<Record>(records.values());
        } finally {
            readWriteLock.readLock().unlock();
        }
    }

    public int size() {

        readWriteLock.readLock().lock();
        try {
            return records.size();
        } finally {
            readWriteLock.readLock().unlock();
        }
    }

    /**
     * @param merge fact-table will be merge into, records with same primary key are replaced.
     * @throws IllegalArgumentException when parameter is null or its layout is different
     */
    void merge(FactTable merge) {

        if (merge == null) {
            throw new IllegalArgumentException();
        }
        if (!meta.sameLayout(merge.meta)) {
            throw new IllegalArgumentException("Can not merge " + merge + " into " + this + ", layout is different.");
        }
        LOGGER.info("Try to merge {} into {}.", merge, this);
        readWriteLock.writeLock().lock();
        try {
            for (Entry<Integer, Record> entry : merge.records.entrySet()) {
                this.records.put(entry.getKey(), entry.getValue());
            }
            meta.integerColumns.retainAll(merge.meta.integerColumns);
        } finally {
            readWriteLock.writeLock().unlock();
        }

        LOGGER.info("Merge {} successfully into {}.", merge, this);
    }

    /**
     * Indicate index by search {@link #meta}, high performance is very important.
     * @param indName Indicate names
     * @return indicate index in fact-table
     * @throws IllegalArgumentException if indicate names is empty or invalid.
     */
    public int getIndIndex(String indName) throws IllegalArgumentException {

        Integer index = null;
        if (indName == null || "".equals(indName) || (index = meta.indColumnNames.get(indName)) == null) {
            throw new IllegalArgumentException("Unknown measure " + indName);
        }

        return index;
    }

    /**
     * Dimension index by search {@link #meta}, high performance is very important.
     * @param dimName Dimension names
     * @return dimension index in fact-table
     * @throws IllegalArgumentException if dimension names is empty or invalid.
     */
    public int getDimIndex(String dimName) throws IllegalArgumentException {

        Integer index = null;
        if (dimName == null || "".equals(dimName) || (index = meta.dimColumnNames.get(dimName)) == null) {
            throw new IllegalArgumentException("Unknown dimension " + dimName);
        }
        return index;
    }

    @Override
    public String toString() {
        return "FactTable [meta=" + meta + ", records=" + records.size() + "]";
    }

}
