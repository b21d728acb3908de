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
 * The built-in element types. The instances are stateless and may be shared freely.
 */
public final class ElementTypes {
    public static final ElementTypeSupport<Double> DOUBLE = new DoubleTypeSupport();
    public static final ElementTypeSupport<Float> FLOAT = new FloatTypeSupport();
    public static final ElementTypeSupport<Integer> INTEGER = new IntegerTypeSupport();
    public static final ElementTypeSupport<Long> LONG = new LongTypeSupport();

    private ElementTypes() {
    }
}
