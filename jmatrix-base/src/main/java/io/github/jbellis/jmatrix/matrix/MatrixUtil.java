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

package io.github.jbellis.jmatrix.matrix;

import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/** Free-function forms of the element-wise matrix transforms */
public final class MatrixUtil {

  private MatrixUtil() {}

  /**
   * Transforms every element of m in place, in row-major order.
   *
   * @param m the matrix to modify
   * @param f the transform
   * @param <T> the element type
   */
  public static <T> void modify(Matrix<T> m, UnaryOperator<T> f) {
    m.modify(f);
  }

  /**
   * Visits every element of m with a handle that can overwrite it.
   *
   * @param m the matrix to modify
   * @param f the visitor
   * @param <T> the element type
   */
  public static <T> void modifyCells(Matrix<T> m, Consumer<Matrix.Cell<T>> f) {
    m.modifyCells(f);
  }

  /**
   * Returns a transformed copy of m; m itself is unchanged.
   *
   * @param m the source matrix
   * @param f the transform
   * @param <T> the element type
   * @return the transformed copy
   */
  public static <T> Matrix<T> applyFunction(Matrix<T> m, UnaryOperator<T> f) {
    return new Matrix<>(m).modify(f);
  }

  /**
   * @param m the matrix to scan
   * @return true if any element of m is NaN
   */
  public static boolean isNaN(Matrix<?> m) {
    return m.hasNaN();
  }
}
