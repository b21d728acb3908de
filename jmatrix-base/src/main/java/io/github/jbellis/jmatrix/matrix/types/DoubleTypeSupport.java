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
 * IEEE 754 double precision elements.
 */
final class DoubleTypeSupport implements ElementTypeSupport<Double> {
    private static final Double ZERO = 0.0;
    private static final Double ONE = 1.0;

    @Override
    public Double zero() {
        return ZERO;
    }

    @Override
    public Double one() {
        return ONE;
    }

    @Override
    public Double add(Double a, Double b) {
        return a + b;
    }

    @Override
    public Double subtract(Double a, Double b) {
        return a - b;
    }

    @Override
    public Double multiply(Double a, Double b) {
        return a * b;
    }

    @Override
    public Double divide(Double a, Double b) {
        return a / b;
    }

    @Override
    public Double negate(Double a) {
        return -a;
    }

    @Override
    public boolean isZero(Double a) {
        // true for both signed zeros
        return a == 0.0;
    }

    @Override
    public int compare(Double a, Double b) {
        return Double.compare(a, b);
    }

    @Override
    public Double normalize(Double a) {
        // folds -0 into +0
        return a == 0.0 ? ZERO : a;
    }

    @Override
    public boolean isNaN(Double a) {
        return Double.isNaN(a);
    }

    @Override
    public String toString() {
        return "Double";
    }
}
