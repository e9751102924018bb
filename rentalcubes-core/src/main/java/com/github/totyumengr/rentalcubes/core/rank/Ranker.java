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
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;

import com.github.totyumengr.rentalcubes.core.Aggregations;
import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;

/**
 * NTILE-style quantile bucketing. Entities are sorted by their ordering measure descending, entities without a value
 * last and ties by id ascending, then cut into <code>k</code> buckets as equal as possible: with
 * <code>r = n mod k</code> the first <code>r</code> buckets hold <code>ceil(n/k)</code> entities, the others
 * <code>floor(n/k)</code>.
 *
 * <p>Ranking needs the complete entity set, so it only runs after all partial aggregations have been merged.
 *
 * @author mengran
 *
 */
public class Ranker {

    private static final Logger LOGGER = LoggerFactory.getLogger(Ranker.class);

    private final int buckets;

    /**
     * @param buckets bucket count, 10 for deciles
     * @throws CubeConfigurationException if buckets is less than 1
     */
    public Ranker(int buckets) throws CubeConfigurationException {
        super();
        if (buckets < 1) {
            throw new CubeConfigurationException("Bucket count must be positive but " + buckets);
        }
        this.buckets = buckets;
    }

    public int getBuckets() {
        return buckets;
    }

    /**
     * @param values ordering measure per entity, <code>null</code> values rank last
     * @param idOrder tie breaker, ascending
     * @return entities in ranking order with their buckets
     */
    public <K> List<RankedEntity<K>> rank(Map<K, BigDecimal> values, Comparator<? super K> idOrder) {

        Assert.notNull(values, "Values can not be null.");
        Assert.notNull(idOrder, "Id order can not be null.");

        List<Entry<K, BigDecimal>> sorted = new ArrayList<Entry<K, BigDecimal>>(values.entrySet());
        sorted.sort(new Comparator<Entry<K, BigDecimal>>() {

            @Override
            public int compare(Entry<K, BigDecimal> o1, Entry<K, BigDecimal> o2) {

                BigDecimal v1 = o1.getValue();
                BigDecimal v2 = o2.getValue();
                if (v1 == null || v2 == null) {
                    if (v1 != v2) {
                        return v1 == null ? 1 : -1;
                    }
                } else {
                    int compared = v2.compareTo(v1);
                    if (compared != 0) {
                        return compared;
                    }
                }
                return idOrder.compare(o1.getKey(), o2.getKey());
            }
        });

        int count = sorted.size();
        List<RankedEntity<K>> ranked = new ArrayList<RankedEntity<K>>(count);
        for (int i = 0; i < count; i++) {
            Entry<K, BigDecimal> e = sorted.get(i);
            ranked.add(new RankedEntity<K>(e.getKey(), e.getValue(), i, bucketOf(i, count)));
        }
        LOGGER.debug("Ranked {} entities into {} buckets.", count, buckets);
        return ranked;
    }

    /**
     * @param position zero based position in ranking order
     * @param count entity count
     * @return bucket number starting from 1
     */
    public int bucketOf(int position, int count) {

        Assert.isTrue(position >= 0 && position < count, "Position " + position + " out of " + count);
        int size = count / buckets;
        int larger = count % buckets;
        int boundary = larger * (size + 1);
        if (position < boundary) {
            return position / (size + 1) + 1;
        }
        return larger + (position - boundary) / size + 1;
    }

    /**
     * Segment summary of buckets <code>fromBucket..toBucket</code>, both inclusive.
     * @param ranked output of {@link #rank(Map, Comparator)}
     * @param fromBucket first bucket
     * @param toBucket last bucket
     * @return member count, total and average of the ordering measure
     */
    public static BucketSummary summarize(Collection<? extends RankedEntity<?>> ranked, int fromBucket,
            int toBucket) {

        Assert.isTrue(fromBucket >= 1 && fromBucket <= toBucket, "Invalid bucket range " + fromBucket + ".."
                + toBucket);
        int members = 0;
        int valued = 0;
        BigDecimal total = BigDecimal.ZERO;
        for (RankedEntity<?> e : ranked) {
            if (e.getBucket() < fromBucket || e.getBucket() > toBucket) {
                continue;
            }
            members++;
            if (e.getValue() != null) {
                valued++;
                total = total.add(e.getValue());
            }
        }
        BigDecimal average = valued == 0 ? null
                : total.divide(BigDecimal.valueOf(valued), Aggregations.IND_SCALE, RoundingMode.HALF_UP);
        return new BucketSummary(fromBucket, toBucket, members, valued, total, average);
    }

    @Override
    public String toString() {
        return "Ranker [buckets=" + buckets + "]";
    }

}
