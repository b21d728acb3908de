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

package io.github.jbellis.jmatrix.util;

import io.github.jbellis.jmatrix.matrix.types.ElementTypeSupport;

/**
 * Utility methods for mathematical operations.
 */
public class MathUtil {
    /** Private constructor to prevent instantiation. */
    private MathUtil() {
    }

    /**
     * Applies the checkerboard sign {@code (-1)^(row + column)} of a cofactor to the given value.
     * Negation goes through the element type, so integer types stay exact.
     *
     * @param type the element type
     * @param value the determinant of the minor
     * @param row the deleted row
     * @param column the deleted column
     * @param <T> the element type
     * @return value if row + column is even, its negation otherwise
     */
    public static <T> T applyCofactorSign(ElementTypeSupport<T> type, T value, int row, int column) {
        return ((row + column) & 1) == 0 ? value : type.negate(value);
    }
}
