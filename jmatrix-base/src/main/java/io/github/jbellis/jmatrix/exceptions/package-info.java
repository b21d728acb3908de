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
 * Provides the exception types raised by JMatrix operations.
 * <p>
 * Each failure kind has its own unchecked exception so that callers can tell them apart
 * programmatically. Each one extends the closest standard Java exception type, so code
 * that only catches the standard type keeps working.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.jbellis.jmatrix.exceptions.DimensionMismatchException} - operand shapes are
 *       incompatible (addition, subtraction, multiplication, hadamard and dot products, row or column
 *       replacement and expansion). Extends {@link java.lang.IllegalArgumentException}.</li>
 *   <li>{@link io.github.jbellis.jmatrix.exceptions.NotSquareMatrixException} - determinant, cofactor,
 *       adjoint or inverse on a non-square matrix. Extends {@link java.lang.IllegalArgumentException}.</li>
 *   <li>{@link io.github.jbellis.jmatrix.exceptions.DivisionByZeroException} - scalar division by zero,
 *       including the inverse of a singular matrix. Extends {@link java.lang.ArithmeticException}.</li>
 *   <li>{@link io.github.jbellis.jmatrix.exceptions.MatrixIndexOutOfBoundsException} - bounds-checked
 *       access outside the matrix. Extends {@link java.lang.IndexOutOfBoundsException}.</li>
 * </ul>
 *
 * <h2>Exception Handling Example</h2>
 * <pre>{@code
 * try {
 *     Matrix<Double> inverse = m.inverse();
 * } catch (DivisionByZeroException e) {
 *     // m is singular
 *     log.warn("Cannot invert {}", m, e);
 * }
 * }</pre>
 * <p>
 * The unchecked accessors ({@code get}, {@code set}, {@code getRow}, {@code extractRow},
 * {@code extractColumn}, {@code changeRow} and {@code changeColumn} by index) do not validate
 * their indices and do not raise any of these types.
 *
 * @see io.github.jbellis.jmatrix.matrix.Matrix
 */
package io.github.jbellis.jmatrix.exceptions;
