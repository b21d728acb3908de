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
 * Thrown when the shapes of two operands are incompatible for the requested operation,
 * or when a row or column supplied to a structural mutator has the wrong length.
 */
public class DimensionMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * @param message description of the incompatible shapes
     */
    public DimensionMismatchException(String message) {
        super(message);
    }

    /**
     * Builds the message for a pair of matrix shapes.
     * @param operation the operation that was attempted
     * @param leftRows rows of the left operand
     * @param leftColumns columns of the left operand
     * @param rightRows rows of the right operand
     * @param rightColumns columns of the right operand
     * @return the new exception
     */
    public static DimensionMismatchException forShapes(String operation, int leftRows, int leftColumns, int rightRows, int rightColumns) {
        return new DimensionMismatchException(String.format("%s undefined for %dx%d and %dx%d matrices",
                                                            operation, leftRows, leftColumns, rightRows, rightColumns));
    }

    /**
     * Builds the message for a row or column of the wrong length.
     * @param what "row" or "column"
     * @param expected the length the matrix requires
     * @param actual the length that was supplied
     * @return the new exception
     */
    public static DimensionMismatchException forLength(String what, int expected, int actual) {
        return new DimensionMismatchException(String.format("%s length %d does not match required length %d", what, actual, expected));
    }
}
