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

import org.junit.Test;

import static org.junit.Assert.*;

public class TestElementTypes {
    @Test
    public void testIdentities() {
        assertEquals(Double.valueOf(0.0), ElementTypes.DOUBLE.zero());
        assertEquals(Double.valueOf(1.0), ElementTypes.DOUBLE.one());
        assertEquals(Float.valueOf(0.0f), ElementTypes.FLOAT.zero());
        assertEquals(Integer.valueOf(1), ElementTypes.INTEGER.one());
        assertEquals(Long.valueOf(0L), ElementTypes.LONG.zero());
    }

    @Test
    public void testIntegerDivisionTruncates() {
        assertEquals(Integer.valueOf(-2), ElementTypes.INTEGER.divide(-7, 3));
        assertEquals(Long.valueOf(2L), ElementTypes.LONG.divide(7L, 3L));
    }

    @Test
    public void testZeroDetection() {
        assertTrue(ElementTypes.DOUBLE.isZero(0.0));
        assertTrue(ElementTypes.DOUBLE.isZero(-0.0));
        assertFalse(ElementTypes.DOUBLE.isZero(Double.MIN_VALUE));
        assertTrue(ElementTypes.FLOAT.isZero(-0.0f));
        assertTrue(ElementTypes.INTEGER.isZero(0));
        assertFalse(ElementTypes.LONG.isZero(1L));
    }

    @Test
    public void testNormalizeFoldsNegativeZero() {
        assertEquals(Double.valueOf(0.0), ElementTypes.DOUBLE.normalize(-0.0));
        assertEquals(Double.valueOf(-1.5), ElementTypes.DOUBLE.normalize(-1.5));
        assertTrue(ElementTypes.DOUBLE.normalize(Double.NaN).isNaN());
        assertEquals(Float.valueOf(0.0f), ElementTypes.FLOAT.normalize(-0.0f));
        assertEquals(Integer.valueOf(-3), ElementTypes.INTEGER.normalize(-3));
        assertEquals(Long.valueOf(0L), ElementTypes.LONG.normalize(0L));
    }

    @Test
    public void testNaNDetection() {
        assertTrue(ElementTypes.DOUBLE.isNaN(Double.NaN));
        assertFalse(ElementTypes.DOUBLE.isNaN(Double.POSITIVE_INFINITY));
        assertTrue(ElementTypes.FLOAT.isNaN(Float.NaN));
        assertFalse(ElementTypes.INTEGER.isNaN(0));
        assertFalse(ElementTypes.LONG.isNaN(0L));
    }

    @Test
    public void testCompareAndNegate() {
        assertTrue(ElementTypes.DOUBLE.compare(-1.0, 2.0) < 0);
        assertTrue(ElementTypes.LONG.compare(5L, 2L) > 0);
        assertEquals(0, ElementTypes.INTEGER.compare(3, 3));
        assertEquals(Integer.valueOf(-3), ElementTypes.INTEGER.negate(3));
        assertEquals(Double.valueOf(2.5), ElementTypes.DOUBLE.negate(-2.5));
    }
}
