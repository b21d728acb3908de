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
 * Thrown by the bounds-checked accessors when a position lies outside
 * {@code [0, rows) x [0, columns)}.
 */
public class MatrixIndexOutOfBoundsException extends IndexOutOfBoundsException {
    private static final long serialVersionUID = 1L;

    private final int row;
    private final int column;

    /**
     * @param row the requested row
     * @param column the requested column
     * @param rows rows of the matrix
     * @param columns columns of the matrix
     */
    public MatrixIndexOutOfBoundsException(int row, int column, int rows, int columns) {
        super(String.format("position (%d, %d) out of range for %dx%d matrix", row, column, rows, columns));
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }
}
