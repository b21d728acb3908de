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

import io.github.jbellis.jmatrix.exceptions.MatrixIndexOutOfBoundsException;
import io.github.jbellis.jmatrix.matrix.types.ElementTypes;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class TestMatrixAccess {
    private static Matrix<Integer> twoByThree() {
        return Matrix.of(ElementTypes.INTEGER, new Integer[][] {{1, 2, 3}, {4, 5, 6}});
    }

    @Test
    public void testCheckedAccessInRange() {
        var m = twoByThree();
        assertEquals(Integer.valueOf(6), m.at(1, 2));
        m.setAt(1, 2, 60);
        assertEquals(Integer.valueOf(60), m.get(1, 2));
    }

    @Test
    public void testCheckedAccessOutOfRange() {
        var m = twoByThree();
        var e = assertThrows(MatrixIndexOutOfBoundsException.class, () -> m.at(m.getCountRows(), 0));
        assertEquals(2, e.getRow());
        assertEquals(0, e.getColumn());
        assertThrows(MatrixIndexOutOfBoundsException.class, () -> m.at(0, 3));
        assertThrows(MatrixIndexOutOfBoundsException.class, () -> m.at(-1, 0));
        assertThrows(MatrixIndexOutOfBoundsException.class, () -> m.setAt(0, 3, 7));
        assertThrows(IndexOutOfBoundsException.class, () -> new Matrix<>(ElementTypes.DOUBLE).at(0, 0));
    }

    @Test
    public void testRowIsLive() {
        var m = twoByThree();
        m.getRow(0).set(1, 20);
        assertEquals(Integer.valueOf(20), m.get(0, 1));
    }

    @Test
    public void testExtractedRowAndColumnAreCopies() {
        var m = twoByThree();
        var row = m.extractRow(1);
        var column = m.extractColumn(2);
        assertEquals(List.of(4, 5, 6), row);
        assertEquals(List.of(3, 6), column);

        row.set(0, 0);
        column.set(0, 0);
        assertEquals(twoByThree(), m);
    }
}
