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
 * Query aborted through {@link QueryContext#cancel()}. No partial result is returned.
 * 
 * @author mengran
 *
 */
public class QueryCancelledException extends CubeException {

    private static final long serialVersionUID = 1L;

    public QueryCancelledException(String message) {
        super(message);
    }
    
    public QueryCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
    
}
