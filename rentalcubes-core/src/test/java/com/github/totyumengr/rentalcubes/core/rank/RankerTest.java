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
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;

import com.github.totyumengr.rentalcubes.core.CubeConfigurationException;

/**
 * @author mengran
 *
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class RankerTest {

    private static Map<Integer, BigDecimal> entities(int count) {

        Map<Integer, BigDecimal> values = new LinkedHashMap<Integer, BigDecimal>();
        for (int i = 1; i <= count; i++) {
            values.put(i, BigDecimal.valueOf(i * 10L));
        }
        return values;
    }

    @Test
    public void test_1_1_DecilesOf95() {

        List<RankedEntity<Integer>> ranked = new Ranker(10).rank(entities(95), Comparator.naturalOrder());

        Map<Integer, Integer> sizes = new HashMap<Integer, Integer>();
        for (RankedEntity<Integer> e : ranked) {
            sizes.merge(e.getBucket(), 1, Integer::sum);
        }
        for (int bucket = 1; bucket <= 5; bucket++) {
            Assert.assertEquals(Integer.valueOf(10), sizes.get(bucket));
        }
        for (int bucket = 6; bucket <= 10; bucket++) {
            Assert.assertEquals(Integer.valueOf(9), sizes.get(bucket));
        }
        // Highest ordering values land in bucket 1
        for (RankedEntity<Integer> e : ranked) {
            Assert.assertEquals(e.getId() > 85, e.getBucket() == 1);
        }
        Assert.assertEquals(Integer.valueOf(95), ranked.get(0).getId());
    }

    @Test
    public void test_1_2_TiesAndMissingValues() {

        Map<String, BigDecimal> values = new LinkedHashMap<String, BigDecimal>();
        values.put("c", BigDecimal.ONE);
        values.put("b", new BigDecimal("1.00"));
        values.put("a", null);
        values.put("d", BigDecimal.TEN);

        List<RankedEntity<String>> ranked = new Ranker(2).rank(values, Comparator.naturalOrder());
        Assert.assertEquals("d", ranked.get(0).getId());
        Assert.assertEquals("b", ranked.get(1).getId());
        Assert.assertEquals("c", ranked.get(2).getId());
        Assert.assertEquals("a", ranked.get(3).getId());
        Assert.assertEquals(1, ranked.get(1).getBucket());
        Assert.assertEquals(2, ranked.get(2).getBucket());
    }

    @Test
    public void test_1_3_FewerEntitiesThanBuckets() {

        List<RankedEntity<Integer>> ranked = new Ranker(10).rank(entities(3), Comparator.naturalOrder());
        Assert.assertEquals(1, ranked.get(0).getBucket());
        Assert.assertEquals(2, ranked.get(1).getBucket());
        Assert.assertEquals(3, ranked.get(2).getBucket());
        Assert.assertTrue(new Ranker(10).rank(entities(0), Comparator.naturalOrder()).isEmpty());
    }

    @Test
    public void test_1_4_SummarizeTopAndBottom() {

        List<RankedEntity<Integer>> ranked = new Ranker(10).rank(entities(20), Comparator.naturalOrder());

        // Top 10%: 200 + 190
        BucketSummary top = Ranker.summarize(ranked, 1, 1);
        Assert.assertEquals(2, top.getMembers());
        Assert.assertEquals(0, new BigDecimal(390).compareTo(top.getTotal()));
        Assert.assertEquals("195.00000000", top.getAverage().toString());

        // Bottom 50%: 10 + .. + 100
        BucketSummary bottom = Ranker.summarize(ranked, 6, 10);
        Assert.assertEquals(10, bottom.getMembers());
        Assert.assertEquals(0, new BigDecimal(550).compareTo(bottom.getTotal()));
    }

    @Test(expected = CubeConfigurationException.class)
    public void test_2_1_ZeroBuckets() {
        new Ranker(0);
    }

}
