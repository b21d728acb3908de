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

import io.github.jbellis.jmatrix.exceptions.DimensionMismatchException;
import io.github.jbellis.jmatrix.exceptions.DivisionByZeroException;
import io.github.jbellis.jmatrix.exceptions.MatrixIndexOutOfBoundsException;
import io.github.jbellis.jmatrix.exceptions.NotSquareMatrixException;
import io.github.jbellis.jmatrix.matrix.types.ElementTypeSupport;
import io.github.jbellis.jmatrix.matrix.types.ElementTypes;
import io.github.jbellis.jmatrix.util.MathUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Dense matrix of a generic numeric element type, stored as a list of rows.
 * <p>
 * Binary operations return new matrices; the {@code *InPlace} forms mutate this matrix and return it.
 * Copies are deep, so two matrices never share storage.
 * <p>
 * {@link #get}, {@link #set}, {@link #getRow}, {@link #extractRow}, {@link #extractColumn},
 * {@link #changeRow} and {@link #changeColumn} do not validate their indices: an invalid index has
 * unspecified results. {@link #at} and {@link #setAt} are the bounds-checked alternatives.
 * <p>
 * The determinant family ({@link #det}, {@link #cofactor}, {@link #adjoint}, {@link #inverse}) uses
 * recursive Laplace expansion, which is exponential in the order of the matrix and has no pivoting.
 * It is intended for small matrices.
 *
 * @param <T> the element type
 */
public class Matrix<T> {
    private static final Logger log = LoggerFactory.getLogger(Matrix.class);

    private static final int LAPLACE_WARN_ORDER = Integer.getInteger("jmatrix.laplace.warn_order", 10);
    private static final boolean MAX_ZERO_SEED = Boolean.getBoolean("jmatrix.max.zero_seed");

    private final ElementTypeSupport<T> type;

    /**
     * The matrix data stored as rows. Every row holds exactly {@code columns} elements, except
     * transiently inside the expand methods.
     */
    List<List<T>> data;
    private int rows;
    private int columns;

    /**
     * Constructs an empty 0x0 matrix.
     * @param type the element type
     */
    public Matrix(ElementTypeSupport<T> type) {
        this.type = Objects.requireNonNull(type);
        this.data = new ArrayList<>();
    }

    /**
     * Constructs an m-by-n matrix with all elements initialized to zero.
     * @param type the element type
     * @param m the number of rows
     * @param n the number of columns
     */
    public Matrix(ElementTypeSupport<T> type, int m, int n) {
        this(type, m, n, type::zero);
    }

    /**
     * Constructs an m-by-n matrix whose elements are produced by the generator, in row-major order.
     * @param type the element type
     * @param m the number of rows
     * @param n the number of columns
     * @param generator called once per element
     */
    public Matrix(ElementTypeSupport<T> type, int m, int n, Supplier<T> generator) {
        if (m < 0 || n < 0) {
            throw new IllegalArgumentException("matrix dimensions must be non-negative, got " + m + "x" + n);
        }
        this.type = Objects.requireNonNull(type);
        this.data = new ArrayList<>(m);
        for (int i = 0; i < m; i++) {
            List<T> row = new ArrayList<>(n);
            for (int j = 0; j < n; j++) {
                row.add(generator.get());
            }
            data.add(row);
        }
        this.rows = m;
        this.columns = n;
    }

    /**
     * Constructs a deep copy of another matrix.
     * @param other the matrix to copy
     */
    public Matrix(Matrix<T> other) {
        this.type = other.type;
        this.data = copyRows(other.data);
        this.rows = other.rows;
        this.columns = other.columns;
    }

    /**
     * Creates a matrix of doubles from a 2D array. Each row of the array becomes a row in the matrix.
     * @param values the elements, values[row][column]
     * @return a new Matrix initialized with the provided values
     * @throws DimensionMismatchException if the rows have different lengths
     */
    public static Matrix<Double> from(double[][] values) {
        var result = new Matrix<>(ElementTypes.DOUBLE);
        for (double[] row : values) {
            var r = new ArrayList<Double>(row.length);
            for (double v : row) {
                r.add(v);
            }
            result.expandRow(r);
        }
        return result;
    }

    /**
     * Creates a matrix from a 2D array of elements.
     * @param type the element type
     * @param values the elements, values[row][column]
     * @param <T> the element type
     * @return a new Matrix initialized with the provided values
     * @throws DimensionMismatchException if the rows have different lengths
     */
    public static <T> Matrix<T> of(ElementTypeSupport<T> type, T[][] values) {
        var result = new Matrix<>(type);
        for (T[] row : values) {
            result.expandRow(Arrays.asList(row));
        }
        return result;
    }

    /**
     * Creates a matrix from a list of rows. The rows are copied.
     * @param type the element type
     * @param rows the rows
     * @param <T> the element type
     * @return a new Matrix initialized with the provided rows
     * @throws DimensionMismatchException if the rows have different lengths
     */
    public static <T> Matrix<T> fromRows(ElementTypeSupport<T> type, List<? extends List<T>> rows) {
        var result = new Matrix<>(type);
        for (List<T> row : rows) {
            result.expandRow(row);
        }
        return result;
    }

    /**
     * @param type the element type
     * @param n the order
     * @param <T> the element type
     * @return the n-by-n identity matrix
     */
    public static <T> Matrix<T> identity(ElementTypeSupport<T> type, int n) {
        var result = new Matrix<>(type, n, n);
        for (int i = 0; i < n; i++) {
            result.set(i, i, type.one());
        }
        return result;
    }

    public ElementTypeSupport<T> getElementType() {
        return type;
    }

    public int getCountRows() {
        return rows;
    }

    public int getCountColumns() {
        return columns;
    }

    /**
     * @return true if the matrix has no rows or no columns
     */
    public boolean isEmpty() {
        return rows == 0 || columns == 0;
    }

    /**
     * Checks if this matrix has the same dimensions as another matrix.
     * @param other the matrix to compare dimensions with
     * @return true if both matrices have the same number of rows and columns, false otherwise
     */
    public boolean isIsomorphicWith(Matrix<?> other) {
        return rows == other.rows && columns == other.columns;
    }

    /**
     * Returns the element at row i and column j. The indices are not checked.
     * @param i the row index
     * @param j the column index
     * @return the matrix element at position (i, j)
     */
    public T get(int i, int j) {
        return data.get(i).get(j);
    }

    /**
     * Sets the element at row i and column j. The indices are not checked.
     * @param i the row index
     * @param j the column index
     * @param value the value to set
     */
    public void set(int i, int j, T value) {
        data.get(i).set(j, value);
    }

    /**
     * Returns the element at row i and column j.
     * @param i the row index
     * @param j the column index
     * @return the matrix element at position (i, j)
     * @throws MatrixIndexOutOfBoundsException if the position lies outside the matrix
     */
    public T at(int i, int j) {
        checkPosition(i, j);
        return get(i, j);
    }

    /**
     * Sets the element at row i and column j.
     * @param i the row index
     * @param j the column index
     * @param value the value to set
     * @throws MatrixIndexOutOfBoundsException if the position lies outside the matrix
     */
    public void setAt(int i, int j, T value) {
        checkPosition(i, j);
        set(i, j, value);
    }

    private void checkPosition(int i, int j) {
        if (i < 0 || i >= rows || j < 0 || j >= columns) {
            throw new MatrixIndexOutOfBoundsException(i, j, rows, columns);
        }
    }

    /**
     * Returns the live row at the given index; writes through it change this matrix.
     * The index is not checked.
     * @param index the row index
     * @return the row
     */
    public List<T> getRow(int index) {
        return data.get(index);
    }

    /**
     * @param index the row index, not checked
     * @return a copy of the row
     */
    public List<T> extractRow(int index) {
        return new ArrayList<>(data.get(index));
    }

    /**
     * @param index the column index, not checked
     * @return a copy of the column
     */
    public List<T> extractColumn(int index) {
        var column = new ArrayList<T>(rows);
        for (List<T> row : data) {
            column.add(row.get(index));
        }
        return column;
    }

    //
    // arithmetic
    //

    /**
     * @param other a matrix of the same shape
     * @return the element-wise sum
     * @throws DimensionMismatchException if the shapes differ
     */
    public Matrix<T> add(Matrix<T> other) {
        requireSameShape("addition", other);
        return combine(other, type::add);
    }

    /**
     * @param other a matrix of the same shape
     * @return the element-wise difference
     * @throws DimensionMismatchException if the shapes differ
     */
    public Matrix<T> subtract(Matrix<T> other) {
        requireSameShape("subtraction", other);
        return combine(other, type::subtract);
    }

    /**
     * @param c the scalar
     * @return a new matrix with every element multiplied by c
     */
    public Matrix<T> scale(T c) {
        return transform(v -> type.multiply(v, c));
    }

    /**
     * @param c the scalar divisor
     * @return a new matrix with every element divided by c
     * @throws DivisionByZeroException if c is zero
     */
    public Matrix<T> divide(T c) {
        requireNonZeroDivisor(c);
        return transform(v -> type.divide(v, c));
    }

    /**
     * Matrix product {@code this * other}. Not commutative.
     * @param other the right operand, with as many rows as this matrix has columns
     * @return a matrix with this matrix's rows and the other matrix's columns
     * @throws DimensionMismatchException if the inner dimensions differ
     */
    public Matrix<T> multiply(Matrix<T> other) {
        if (columns != other.rows) {
            throw DimensionMismatchException.forShapes("matrix multiplication", rows, columns, other.rows, other.columns);
        }
        var result = new Matrix<>(type, rows, other.columns);
        for (int i = 0; i < rows; i++) {
            List<T> left = data.get(i);
            List<T> out = result.data.get(i);
            for (int j = 0; j < other.columns; j++) {
                T acc = type.zero();
                for (int k = 0; k < columns; k++) {
                    acc = type.add(acc, type.multiply(left.get(k), other.get(k, j)));
                }
                out.set(j, acc);
            }
        }
        return result;
    }

    /**
     * @param other a matrix of the same shape
     * @return the element-wise product
     * @throws DimensionMismatchException if the shapes differ
     */
    public Matrix<T> hadamardProduct(Matrix<T> other) {
        requireSameShape("hadamard product", other);
        return combine(other, type::multiply);
    }

    /**
     * Frobenius inner product: the sum over all positions of the products of corresponding elements.
     * @param other a matrix of the same shape
     * @return the dot product
     * @throws DimensionMismatchException if the shapes differ
     */
    public T dot(Matrix<T> other) {
        requireSameShape("dot product", other);
        T s = type.zero();
        for (int i = 0; i < rows; i++) {
            List<T> a = data.get(i);
            List<T> b = other.data.get(i);
            for (int j = 0; j < columns; j++) {
                s = type.add(s, type.multiply(a.get(j), b.get(j)));
            }
        }
        return s;
    }

    /**
     * @return a new matrix with rows and columns swapped
     */
    public Matrix<T> transposed() {
        var result = new Matrix<>(type, columns, rows);
        for (int i = 0; i < rows; i++) {
            List<T> row = data.get(i);
            for (int j = 0; j < columns; j++) {
                result.data.get(j).set(i, row.get(j));
            }
        }
        return result;
    }

    /**
     * Adds another matrix to this matrix element-wise, modifying this matrix in place.
     * @param other the matrix to add to this matrix
     * @return this matrix
     * @throws DimensionMismatchException if the matrices have different dimensions
     */
    public Matrix<T> addInPlace(Matrix<T> other) {
        requireSameShape("addition", other);
        return combineInPlace(other, type::add);
    }

    /**
     * @param other the matrix to subtract from this matrix
     * @return this matrix
     * @throws DimensionMismatchException if the matrices have different dimensions
     */
    public Matrix<T> subtractInPlace(Matrix<T> other) {
        requireSameShape("subtraction", other);
        return combineInPlace(other, type::subtract);
    }

    /**
     * Subtracts a constant from every element.
     * @param c the constant
     * @return this matrix
     */
    public Matrix<T> subtractInPlace(T c) {
        return modify(v -> type.subtract(v, c));
    }

    /**
     * Multiplies all elements in the matrix by a scalar value, modifying the matrix in place.
     * @param multiplier the scalar value to multiply each matrix element by
     * @return this matrix
     */
    public Matrix<T> scaleInPlace(T multiplier) {
        return modify(v -> type.multiply(v, multiplier));
    }

    /**
     * Replaces this matrix with {@code this * other}.
     * @param other the right operand
     * @return this matrix
     * @throws DimensionMismatchException if the inner dimensions differ
     */
    public Matrix<T> multiplyInPlace(Matrix<T> other) {
        copyFrom(multiply(other));
        return this;
    }

    /**
     * @param c the scalar divisor
     * @return this matrix
     * @throws DivisionByZeroException if c is zero
     */
    public Matrix<T> divideInPlace(T c) {
        requireNonZeroDivisor(c);
        return modify(v -> type.divide(v, c));
    }

    private void requireSameShape(String operation, Matrix<?> other) {
        if (!isIsomorphicWith(other)) {
            throw DimensionMismatchException.forShapes(operation, rows, columns, other.rows, other.columns);
        }
    }

    private void requireNonZeroDivisor(T c) {
        if (type.isZero(c)) {
            throw new DivisionByZeroException("division of " + rows + "x" + columns + " matrix by zero");
        }
    }

    private Matrix<T> combine(Matrix<T> other, BinaryOperator<T> f) {
        var result = new Matrix<>(type, rows, columns);
        for (int i = 0; i < rows; i++) {
            List<T> a = data.get(i);
            List<T> b = other.data.get(i);
            List<T> out = result.data.get(i);
            for (int j = 0; j < columns; j++) {
                out.set(j, f.apply(a.get(j), b.get(j)));
            }
        }
        return result;
    }

    private Matrix<T> combineInPlace(Matrix<T> other, BinaryOperator<T> f) {
        for (int i = 0; i < rows; i++) {
            List<T> a = data.get(i);
            List<T> b = other.data.get(i);
            for (int j = 0; j < columns; j++) {
                a.set(j, f.apply(a.get(j), b.get(j)));
            }
        }
        return this;
    }

    private Matrix<T> transform(UnaryOperator<T> f) {
        var result = new Matrix<>(this);
        result.modify(f);
        return result;
    }

    //
    // structural mutation
    //

    /**
     * Appends a column. On a matrix without rows, each element of the column starts a new row.
     * @param newCol the column, with one element per row
     * @throws DimensionMismatchException if the column length differs from the row count
     */
    public void expandColumn(List<T> newCol) {
        if (rows == 0) {
            // a 0xN matrix has no rows to seed, so only an empty column keeps every row N+1 wide
            if (columns != 0 && !newCol.isEmpty()) {
                throw DimensionMismatchException.forLength("column", 0, newCol.size());
            }
            for (T value : newCol) {
                List<T> row = new ArrayList<>();
                row.add(value);
                data.add(row);
            }
            rows = newCol.size();
        } else {
            if (newCol.size() != rows) {
                throw DimensionMismatchException.forLength("column", rows, newCol.size());
            }
            for (int i = 0; i < rows; i++) {
                data.get(i).add(newCol.get(i));
            }
        }
        columns++;
    }

    /**
     * Appends a row. On a matrix without columns, the row's length sets the column count.
     * @param newRow the row; it is copied
     * @throws DimensionMismatchException if the row length differs from the column count
     */
    public void expandRow(List<T> newRow) {
        if (columns == 0) {
            if (rows != 0 && !newRow.isEmpty()) {
                throw DimensionMismatchException.forLength("row", 0, newRow.size());
            }
            columns = newRow.size();
        } else if (newRow.size() != columns) {
            throw DimensionMismatchException.forLength("row", columns, newRow.size());
        }
        data.add(new ArrayList<>(newRow));
        rows++;
    }

    /**
     * Replaces the values of an existing row. The index is not checked.
     * @param row the new values
     * @param index the row to replace
     * @throws DimensionMismatchException if the row length differs from the column count
     */
    public void changeRow(List<T> row, int index) {
        if (row.size() != columns) {
            throw DimensionMismatchException.forLength("row", columns, row.size());
        }
        List<T> target = data.get(index);
        for (int j = 0; j < columns; j++) {
            target.set(j, row.get(j));
        }
    }

    /**
     * Replaces the values of an existing column. The index is not checked.
     * @param column the new values
     * @param index the column to replace
     * @throws DimensionMismatchException if the column length differs from the row count
     */
    public void changeColumn(List<T> column, int index) {
        if (column.size() != rows) {
            throw DimensionMismatchException.forLength("column", rows, column.size());
        }
        for (int i = 0; i < rows; i++) {
            data.get(i).set(index, column.get(i));
        }
    }

    /**
     * Replaces the contents and dimensions of this matrix with a deep copy of another.
     * @param other the source matrix
     */
    public void copyFrom(Matrix<T> other) {
        if (other == this) {
            return;
        }
        data = copyRows(other.data);
        rows = other.rows;
        columns = other.columns;
    }

    /**
     * Resets this matrix to the empty 0x0 state.
     */
    public void clear() {
        data = new ArrayList<>();
        rows = 0;
        columns = 0;
    }

    private static <T> List<List<T>> copyRows(List<List<T>> source) {
        var copy = new ArrayList<List<T>>(source.size());
        for (List<T> row : source) {
            copy.add(new ArrayList<>(row));
        }
        return copy;
    }

    //
    // element-wise transforms
    //

    /**
     * @param other a matrix of the same shape
     * @param f combines an element of this matrix with the element at the same position in other
     * @return a new matrix of the combined values
     * @throws DimensionMismatchException if the shapes differ
     */
    public Matrix<T> applyOperation(Matrix<T> other, BinaryOperator<T> f) {
        requireSameShape("element-wise operation", other);
        return combine(other, f);
    }

    /**
     * @param f applied to every element
     * @return a new matrix of the transformed values
     */
    public Matrix<T> applyOperation(UnaryOperator<T> f) {
        return transform(f);
    }

    /**
     * Replaces every element with the result of f, in row-major order.
     * @param f the transform
     * @return this matrix
     */
    public Matrix<T> modify(UnaryOperator<T> f) {
        for (List<T> row : data) {
            row.replaceAll(f);
        }
        return this;
    }

    /**
     * Visits every element in row-major order with a handle that can overwrite it.
     * @param f the visitor
     * @return this matrix
     */
    public Matrix<T> modifyCells(Consumer<Cell<T>> f) {
        var cell = new Cell<T>(this);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                cell.row = i;
                cell.column = j;
                f.accept(cell);
            }
        }
        return this;
    }

    /**
     * @return the total of all elements, or zero for an empty matrix
     */
    public T sum() {
        T s = type.zero();
        for (List<T> row : data) {
            for (T value : row) {
                s = type.add(s, value);
            }
        }
        return s;
    }

    /**
     * Returns the largest element, or zero for an empty matrix. NaN elements are skipped; a matrix whose
     * elements are all NaN reports NaN. With {@code -Djmatrix.max.zero_seed=true} the search starts from
     * zero instead of the first element, so a matrix of negative values reports zero.
     * @return the largest element
     */
    public T max() {
        if (isEmpty()) {
            return type.zero();
        }
        T supremum = MAX_ZERO_SEED ? type.zero() : null;
        for (List<T> row : data) {
            for (T value : row) {
                if (type.isNaN(value)) {
                    continue;
                }
                if (supremum == null || type.compare(value, supremum) > 0) {
                    supremum = value;
                }
            }
        }
        return supremum == null ? get(0, 0) : supremum;
    }

    /**
     * @return true if any element is NaN
     */
    public boolean hasNaN() {
        for (List<T> row : data) {
            for (T value : row) {
                if (type.isNaN(value)) {
                    return true;
                }
            }
        }
        return false;
    }

    //
    // determinant family
    //

    /**
     * Computes the determinant by Laplace expansion along the first row. A 0x0 matrix has determinant one.
     * @return the determinant
     * @throws NotSquareMatrixException if the matrix is not square
     */
    public T det() {
        requireSquare("determinant");
        if (rows >= LAPLACE_WARN_ORDER) {
            log.warn("Determinant of a {}x{} matrix by Laplace expansion; cost grows factorially with order {}", rows, columns, rows);
        }
        return laplace();
    }

    private T laplace() {
        switch (rows) {
            case 0:
                return type.one();
            case 1:
                return get(0, 0);
            case 2:
                return type.subtract(type.multiply(get(0, 0), get(1, 1)), type.multiply(get(0, 1), get(1, 0)));
            default:
                T det = type.zero();
                List<T> first = data.get(0);
                for (int j = 0; j < columns; j++) {
                    det = type.add(det, type.multiply(first.get(j), signedMinorDeterminant(0, j)));
                }
                return det;
        }
    }

    /**
     * Builds the minor obtained by deleting one row and one column.
     * @param i the row to delete
     * @param j the column to delete
     * @return the (n-1)x(n-1) sub-matrix
     * @throws NotSquareMatrixException if the matrix is not square
     */
    public Matrix<T> minor(int i, int j) {
        requireSquare("minor");
        return subMatrix(i, j);
    }

    private Matrix<T> subMatrix(int i, int j) {
        var sub = new Matrix<T>(type);
        sub.data = new ArrayList<>(rows - 1);
        for (int r = 0; r < rows; r++) {
            if (r == i) {
                continue;
            }
            List<T> source = data.get(r);
            var row = new ArrayList<T>(columns - 1);
            for (int c = 0; c < columns; c++) {
                if (c != j) {
                    row.add(source.get(c));
                }
            }
            sub.data.add(row);
        }
        sub.rows = rows - 1;
        sub.columns = columns - 1;
        return sub;
    }

    /**
     * @param i the row index
     * @param j the column index
     * @return the determinant of the (i, j) minor multiplied by {@code (-1)^(i+j)}
     * @throws NotSquareMatrixException if the matrix is not square
     */
    public T cofactor(int i, int j) {
        requireSquare("cofactor");
        return signedMinorDeterminant(i, j);
    }

    private T signedMinorDeterminant(int i, int j) {
        return MathUtil.applyCofactorSign(type, subMatrix(i, j).laplace(), i, j);
    }

    /**
     * @return the matrix whose (i, j) element is {@code cofactor(i, j)}
     * @throws NotSquareMatrixException if the matrix is not square
     */
    public Matrix<T> cofactorMatrix() {
        requireSquare("cofactor matrix");
        var result = new Matrix<>(type, rows, columns);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result.set(i, j, signedMinorDeterminant(i, j));
            }
        }
        return result;
    }

    /**
     * @return the adjugate, the transpose of the cofactor matrix
     * @throws NotSquareMatrixException if the matrix is not square
     */
    public Matrix<T> adjoint() {
        requireSquare("adjoint");
        var result = new Matrix<>(type, rows, columns);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                result.set(j, i, signedMinorDeterminant(i, j));
            }
        }
        return result;
    }

    /**
     * Inverts a square matrix as its adjoint divided by its determinant.
     * For integer element types the division truncates.
     * @return the inverse of the matrix
     * @throws NotSquareMatrixException if the matrix is not square
     * @throws DivisionByZeroException if the matrix is singular
     */
    public Matrix<T> inverse() {
        requireSquare("inverse");
        T det = det();
        log.debug("Inverting {}x{} matrix with determinant {}", rows, columns, det);
        return adjoint().divide(det);
    }

    private void requireSquare(String operation) {
        if (rows != columns) {
            throw new NotSquareMatrixException(operation, rows, columns);
        }
    }

    //
    // output
    //

    /**
     * Writes each row as {@code |e1|e2|...|en|} followed by a newline, then a blank line.
     * @param out the destination
     */
    public void print(PrintStream out) {
        out.print(this);
    }

    /**
     * Prints to standard output.
     */
    public void print() {
        print(System.out);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (List<T> row : data) {
            sb.append('|');
            for (T value : row) {
                sb.append(value).append('|');
            }
            sb.append('\n');
        }
        sb.append('\n');
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Matrix)) {
            return false;
        }

        var other = (Matrix<?>) obj;
        if (rows != other.rows || columns != other.columns) {
            return false;
        }
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                if (!Objects.equals(normalized(i, j), other.normalized(i, j))) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(rows, columns);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                h = 31 * h + Objects.hashCode(normalized(i, j));
            }
        }
        return h;
    }

    private Object normalized(int i, int j) {
        return type.normalize(get(i, j));
    }

    /**
     * A movable handle on one element, passed to {@link #modifyCells}. The handle is reused across
     * elements and must not be retained after the callback returns.
     *
     * @param <T> the element type
     */
    public static final class Cell<T> {
        private final Matrix<T> matrix;
        int row;
        int column;

        Cell(Matrix<T> matrix) {
            this.matrix = matrix;
        }

        public int row() {
            return row;
        }

        public int column() {
            return column;
        }

        public T get() {
            return matrix.get(row, column);
        }

        public void set(T value) {
            matrix.set(row, column, value);
        }
    }
}
