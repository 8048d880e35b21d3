/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.cyclus.core.exceptions;

/**
 * Base exception class for all Cyclus-related exceptions.
 * Compilation of a workflow either succeeds completely or fails with a
 * subclass of this exception; there is no partial result.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class CyclusException extends Exception {

    public CyclusException(String message) {
        super(message);
    }

    public CyclusException(String message, Throwable cause) {
        super(message, cause);
    }

    public CyclusException(Throwable cause) {
        super(cause);
    }
}
