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
 * Provides the generic dense matrix type and its element-wise helpers.
 * <p>
 * <b>Key Components:</b>
 * <ul>
 *   <li><b>Matrix</b> - {@link io.github.jbellis.jmatrix.matrix.Matrix} is an M-by-N grid with value
 *       semantics. It supports arithmetic, the hadamard and dot products, transposition, structural
 *       mutation (row and column expansion, replacement and extraction), and the cofactor family of
 *       linear-algebra operations (determinant, cofactor, adjoint, inverse) computed by Laplace
 *       expansion.</li>
 *   <li><b>Element types</b> - a matrix delegates all element arithmetic to an
 *       {@link io.github.jbellis.jmatrix.matrix.types.ElementTypeSupport}; the built-in types are in
 *       {@link io.github.jbellis.jmatrix.matrix.types.ElementTypes}.</li>
 *   <li><b>Matrix Utilities</b> - {@link io.github.jbellis.jmatrix.matrix.MatrixUtil} provides static
 *       forms of the element-wise transforms and NaN detection.</li>
 * </ul>
 * <p>
 * <b>Usage Example:</b>
 * <pre>{@code
 * Matrix<Double> a = Matrix.from(new double[][] {{4, 7}, {2, 6}});
 * double det = a.det();                  // 10.0
 * Matrix<Double> inv = a.inverse();      // adjoint / det
 * Matrix<Double> id = a.multiply(inv);   // identity, within rounding
 * }</pre>
 * <p>
 * <b>Configuration</b> is read from system properties when {@code Matrix} is first loaded:
 * <ul>
 *   <li>{@code jmatrix.laplace.warn_order} (default 10) - {@code det()} logs a warning at or above this order.</li>
 *   <li>{@code jmatrix.max.zero_seed} (default false) - seed {@code max()} with zero instead of the first element.</li>
 * </ul>
 *
 * @see io.github.jbellis.jmatrix.matrix.types
 * @see io.github.jbellis.jmatrix.exceptions
 */
package io.github.jbellis.jmatrix.matrix;
