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

/**
 * Element type abstractions for {@link io.github.jbellis.jmatrix.matrix.Matrix}.
 * <p>
 * {@link io.github.jbellis.jmatrix.matrix.types.ElementTypeSupport} is the arithmetic bound a matrix
 * places on its element type. {@link io.github.jbellis.jmatrix.matrix.types.ElementTypes} holds the
 * implementations for {@code Double}, {@code Float}, {@code Integer} and {@code Long}; other numeric
 * types can be supported by implementing the interface directly.
 */
package io.github.jbellis.jmatrix.matrix.types;
