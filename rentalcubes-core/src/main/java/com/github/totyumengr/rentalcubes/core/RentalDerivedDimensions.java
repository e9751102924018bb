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

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.Function;

/**
 * Derived dimensions used by the movie-rental reports: birth decade cohorts, rental calendar parts and price tiers.
 *
 * @author mengran
 *
 */
public class RentalDerivedDimensions implements DerivedDimensionProvider {

    public static final String BIRTH_DECADE = "birthDecade";
    public static final String RENTAL_YEAR = "rentalYear";
    public static final String RENTAL_MONTH = "rentalMonth";
    public static final String DAY_TYPE = "dayType";
    public static final String PRICE_TIER = "priceTier";

    private static final BigDecimal ONE = BigDecimal.ONE;
    private static final BigDecimal TWO = new BigDecimal(2);
    private static final BigDecimal THREE = new BigDecimal(3);
    private static final BigDecimal FOUR = new BigDecimal(4);

    private static class SingleSourceDimension implements DerivedDimension {

        private final ValueType type;
        private final String source;
        private final Function<Object, Object> function;

        SingleSourceDimension(ValueType type, String source, Function<Object, Object> function) {
            super();
            this.type = type;
            this.source = source;
            this.function = function;
        }

        @Override
        public ValueType getType() {
            return type;
        }

        @Override
        public List<String> getSourceColumns() {
            return Collections.singletonList(source);
        }

        @Override
        public Object derive(List<Object> sourceValues) {

            Object value = sourceValues.get(0);
            return value == null ? null : function.apply(value);
        }

        @Override
        public String toString() {
            return type + "(" + source + ")";
        }
    }

    @Override
    public int getOrder() {
        return 0;
    }

    @Override
    public LinkedHashMap<String, DerivedDimension> getDerivedDimensionConfig() {

        LinkedHashMap<String, DerivedDimension> map = new LinkedHashMap<String, DerivedDimension>(5);
        map.put(BIRTH_DECADE, new SingleSourceDimension(ValueType.TEXT, "dateOfBirth", v -> birthDecade((LocalDate) v)));
        map.put(RENTAL_YEAR, new SingleSourceDimension(ValueType.NUMBER, "rentalDate", v -> ((LocalDate) v).getYear()));
        map.put(RENTAL_MONTH, new SingleSourceDimension(ValueType.NUMBER, "rentalDate", v -> ((LocalDate) v).getMonthValue()));
        map.put(DAY_TYPE, new SingleSourceDimension(ValueType.TEXT, "rentalDate", v -> dayType((LocalDate) v)));
        map.put(PRICE_TIER, new SingleSourceDimension(ValueType.TEXT, "price",
                v -> priceTier(ValueType.toBigDecimal((Number) v))));
        return map;
    }

    static String birthDecade(LocalDate dateOfBirth) {

        int year = dateOfBirth.getYear();
        if (year < 1950 || year > 1999) {
            return "Other";
        }
        return (year / 10 * 10) + "s";
    }

    static String dayType(LocalDate date) {

        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? "Weekend" : "Weekday";
    }

    static String priceTier(BigDecimal price) {

        if (price.compareTo(ONE) < 0) {
            return "Budget (<$1.00)";
        } else if (price.compareTo(TWO) < 0) {
            return "Economy ($1.00-$1.99)";
        } else if (price.compareTo(THREE) < 0) {
            return "Standard ($2.00-$2.99)";
        } else if (price.compareTo(FOUR) < 0) {
            return "Premium ($3.00-$3.99)";
        }
        return "Luxury ($4.00+)";
    }

}
