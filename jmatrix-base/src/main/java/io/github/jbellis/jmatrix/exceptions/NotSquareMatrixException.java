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
 * Thrown when a determinant, cofactor, adjoint or inverse is requested on a matrix
 * whose row count differs from its column count.
 */
public class NotSquareMatrixException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int rows;
    private final int columns;

    /**
     * @param operation the operation that was attempted
     * @param rows rows of the offending matrix
     * @param columns columns of the offending matrix
     */
    public NotSquareMatrixException(String operation, int rows, int columns) {
        super(String.format("%s is defined only for square matrices, got %dx%d", operation, rows, columns));
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }
}
