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

import java.util.LinkedHashMap;

import org.springframework.core.Ordered;

/**
 * Contributes derived dimension columns to every {@link FactTable} that has their source columns. Implementations are
 * discovered with {@link java.util.ServiceLoader} and applied by {@link #getOrder()}.
 * 
 * @author mengran
 *
 */
public interface DerivedDimensionProvider extends Ordered {
    
    /**
     * 
     * @return column name and definition of derived dimensions. MUST NOT NULL.
     */
    LinkedHashMap<String, DerivedDimension> getDerivedDimensionConfig();
}
