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
 * IEEE 754 single precision elements.
 */
final class FloatTypeSupport implements ElementTypeSupport<Float> {
    private static final Float ZERO = 0.0f;
    private static final Float ONE = 1.0f;

    @Override
    public Float zero() {
        return ZERO;
    }

    @Override
    public Float one() {
        return ONE;
    }

    @Override
    public Float add(Float a, Float b) {
        return a + b;
    }

    @Override
    public Float subtract(Float a, Float b) {
        return a - b;
    }

    @Override
    public Float multiply(Float a, Float b) {
        return a * b;
    }

    @Override
    public Float divide(Float a, Float b) {
        return a / b;
    }

    @Override
    public Float negate(Float a) {
        return -a;
    }

    @Override
    public boolean isZero(Float a) {
        return a == 0.0f;
    }

    @Override
    public int compare(Float a, Float b) {
        return Float.compare(a, b);
    }

    @Override
    public Float normalize(Float a) {
        // folds -0 into +0
        return a == 0.0f ? ZERO : a;
    }

    @Override
    public boolean isNaN(Float a) {
        return Float.isNaN(a);
    }

    @Override
    public String toString() {
        return "Float";
    }
}
