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
package com.github.totyumengr.rentalcubes.core.aggregate;

/**
 * Values derivable from an {@link Accumulator}. <code>COUNT</code> without argument is <code>COUNT(*)</code>, with a
 * measure argument it counts the non-null values. <code>COUNT_DISTINCT</code> takes an integer attribute.
 *
 * @author mengran
 *
 */
public enum AggregateFunction {

    COUNT, SUM, AVG, MIN, MAX, COUNT_DISTINCT;

    public String label(String argument) {
        return name() + "(" + (argument == null ? "*" : argument) + ")";
    }

}
