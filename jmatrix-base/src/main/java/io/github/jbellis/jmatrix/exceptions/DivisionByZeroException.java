/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jbellis.jmatrix.exceptions;

/**
 * Thrown when a matrix is divided by a scalar equal to its element type's zero.
 * Inverting a singular matrix surfaces as this exception, since the inverse is the
 * adjoint divided by a zero determinant.
 */
public class DivisionByZeroException extends ArithmeticException {
    private static final long serialVersionUID = 1L;

    /**
     * @param message description of the failed division
     */
    public DivisionByZeroException(String message) {
        super(message);
    }
}
