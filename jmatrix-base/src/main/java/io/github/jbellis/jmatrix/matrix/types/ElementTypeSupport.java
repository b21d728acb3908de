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

package io.github.jbellis.jmatrix.matrix.types;

/**
 * Arithmetic over a matrix element type. A {@code Matrix<T>} delegates every operation on its
 * elements to one of these, which is what makes the matrix generic over any numeric type that
 * supports the four basic operations, a zero test and an ordering.
 *
 * @param <T> the boxed element type
 */
public interface ElementTypeSupport<T> {
    /**
     * @return the additive identity
     */
    T zero();

    /**
     * @return the multiplicative identity
     */
    T one();

    T add(T a, T b);

    T subtract(T a, T b);

    T multiply(T a, T b);

    /**
     * Divide a by b. Implementations follow the semantics of the underlying type; callers that
     * must reject a zero divisor check {@link #isZero(Object)} first.
     * @param a the dividend
     * @param b the divisor
     * @return the quotient
     */
    T divide(T a, T b);

    T negate(T a);

    /**
     * @param a the value to test
     * @return true if a equals this type's zero value
     */
    boolean isZero(T a);

    /**
     * Compare two values with the natural ordering of the type.
     * @param a the first value
     * @param b the second value
     * @return a negative integer, zero, or a positive integer as a is less than, equal to, or greater than b
     */
    int compare(T a, T b);

    /**
     * Maps a value to the canonical representative of its equality class, so that values this type
     * considers equal (for instance {@code -0.0} and {@code +0.0}) compare and hash the same.
     * @param a the value
     * @return the canonical form of a
     */
    default T normalize(T a) {
        return a;
    }

    /**
     * @param a the value to test
     * @return true if a is not a number; always false for types without a NaN value
     */
    default boolean isNaN(T a) {
        return false;
    }
}
