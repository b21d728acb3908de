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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jbellis.jmatrix.exceptions.DivisionByZeroException;
import io.github.jbellis.jmatrix.exceptions.NotSquareMatrixException;
import io.github.jbellis.jmatrix.matrix.types.ElementTypes;
import org.apache.commons.math3.linear.LUDecomposition;
import org.junit.Test;

import static io.github.jbellis.jmatrix.TestUtil.assertMatrixEquals;
import static io.github.jbellis.jmatrix.TestUtil.randomDoubleMatrix;
import static io.github.jbellis.jmatrix.TestUtil.randomLongMatrix;
import static io.github.jbellis.jmatrix.TestUtil.randomWellConditioned;
import static io.github.jbellis.jmatrix.TestUtil.toRealMatrix;
import static org.junit.Assert.*;

@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestDeterminant extends RandomizedTest {
    @Test
    public void testBaseCases() {
        assertEquals(Double.valueOf(1.0), new Matrix<>(ElementTypes.DOUBLE).det());
        assertEquals(Double.valueOf(-7.5), Matrix.from(new double[][] {{-7.5}}).det());
        assertEquals(Double.valueOf(-2.0), Matrix.from(new double[][] {{1, 2}, {3, 4}}).det());
        assertEquals(Double.valueOf(1.0), Matrix.from(new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}}).det());
    }

    @Test
    public void testLaplaceExpansion() {
        var m = Matrix.of(ElementTypes.INTEGER, new Integer[][] {{2, -3, 1}, {2, 0, -1}, {1, 4, 5}});
        assertEquals(Integer.valueOf(49), m.det());

        var m4 = Matrix.of(ElementTypes.LONG, new Long[][] {
                {1L, 0L, 2L, -1L},
                {3L, 0L, 0L, 5L},
                {2L, 1L, 4L, -3L},
                {1L, 0L, 5L, 0L}});
        assertEquals(Long.valueOf(30L), m4.det());
    }

    @Test
    public void testNonSquareRejected() {
        var m = new Matrix<>(ElementTypes.DOUBLE, 2, 3);
        var e = assertThrows(NotSquareMatrixException.class, m::det);
        assertEquals(2, e.getRows());
        assertEquals(3, e.getColumns());
        assertThrows(NotSquareMatrixException.class, () -> m.cofactor(0, 0));
        assertThrows(NotSquareMatrixException.class, () -> m.minor(0, 0));
        assertThrows(NotSquareMatrixException.class, m::cofactorMatrix);
        assertThrows(NotSquareMatrixException.class, m::adjoint);
        assertThrows(NotSquareMatrixException.class, m::inverse);
    }

    @Test
    public void testMinorAndCofactor() {
        var m = Matrix.of(ElementTypes.INTEGER, new Integer[][] {{1, 2, 3}, {4, 5, 6}, {7, 8, 10}});
        assertEquals(Matrix.of(ElementTypes.INTEGER, new Integer[][] {{1, 3}, {7, 10}}), m.minor(1, 1));
        assertEquals(Matrix.of(ElementTypes.INTEGER, new Integer[][] {{4, 5}, {7, 8}}), m.minor(0, 2));
        // sign alternates with (i + j)
        assertEquals(Integer.valueOf(-11), m.cofactor(1, 1));
        assertEquals(Integer.valueOf(2), m.cofactor(0, 1));
        assertEquals(Integer.valueOf(4), m.cofactor(1, 0));
        assertEquals(Integer.valueOf(-3), m.cofactor(2, 2));
    }

    @Test
    public void testAdjointIsTransposedCofactors() {
        var m = Matrix.of(ElementTypes.INTEGER, new Integer[][] {{1, 2, 3}, {0, 1, 4}, {5, 6, 0}});
        var expected = Matrix.of(ElementTypes.INTEGER, new Integer[][] {{-24, 18, 5}, {20, -15, -4}, {-5, 4, 1}});
        assertEquals(expected, m.adjoint());
        assertEquals(expected.transposed(), m.cofactorMatrix());
        assertEquals(Matrix.of(ElementTypes.INTEGER, new Integer[][] {{1}}), Matrix.of(ElementTypes.INTEGER, new Integer[][] {{9}}).adjoint());
    }

    @Test
    public void testInverse() {
        var m = Matrix.from(new double[][] {{4, 7}, {2, 6}});
        var inverse = m.inverse();
        assertMatrixEquals(Matrix.from(new double[][] {{0.6, -0.7}, {-0.2, 0.4}}), inverse, 1e-12);
        assertMatrixEquals(Matrix.identity(ElementTypes.DOUBLE, 2), m.multiply(inverse), 1e-12);

        var adjugateMatrix = Matrix.of(ElementTypes.INTEGER, new Integer[][] {{1, 2, 3}, {0, 1, 4}, {5, 6, 0}});
        assertEquals(Matrix.of(ElementTypes.INTEGER, new Integer[][] {{-24, 18, 5}, {20, -15, -4}, {-5, 4, 1}}), adjugateMatrix.inverse());
    }

    @Test
    public void testSingularInverseRejected() {
        var singular = Matrix.from(new double[][] {{1, 2, 3}, {2, 4, 6}, {1, 1, 1}});
        assertEquals(0.0, singular.det(), 0.0);
        assertThrows(DivisionByZeroException.class, singular::inverse);
        assertThrows(DivisionByZeroException.class, () -> Matrix.from(new double[][] {{0}}).inverse());
    }

    @Test
    public void testDeterminantMatchesLU() {
        for (int trial = 0; trial < 30; trial++) {
            int n = randomIntBetween(1, 6);
            var m = randomDoubleMatrix(getRandom(), n, n);
            double expected = new LUDecomposition(toRealMatrix(m)).getDeterminant();
            assertEquals(expected, m.det(), 1e-9 * Math.max(1e3, Math.abs(expected)));
        }
    }

    @Test
    public void testDeterminantOfTransposeIsExact() {
        for (int trial = 0; trial < 30; trial++) {
            int n = randomIntBetween(0, 5);
            var m = randomLongMatrix(getRandom(), n, n);
            assertEquals(m.det(), m.transposed().det());
        }
    }

    @Test
    public void testInverseMatchesLU() {
        for (int trial = 0; trial < 30; trial++) {
            int n = randomIntBetween(1, 5);
            var m = randomWellConditioned(getRandom(), n);
            var inverse = m.inverse();
            var expected = new LUDecomposition(toRealMatrix(m)).getSolver().getInverse();
            assertMatrixEquals(expected, inverse, 1e-9);
            assertMatrixEquals(Matrix.identity(ElementTypes.DOUBLE, n), m.multiply(inverse), 1e-9);
            assertEquals(1.0 / m.det(), inverse.det(), 1e-9 * Math.abs(1.0 / m.det()));
        }
    }
}
