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
 * Invalid grouping specification or query layout, e.g. empty dimension list, foreign or duplicate grouping sets, too many dimensions or unknown columns.
 * 
 * @author mengran
 *
 */
public class CubeConfigurationException extends CubeException {

    private static final long serialVersionUID = 1L;

    public CubeConfigurationException(String message) {
        super(message);
    }
    
    public CubeConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
    
}
