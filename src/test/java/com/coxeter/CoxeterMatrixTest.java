package com.coxeter;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class CoxeterMatrixTest {

    @Test
    public void testBuilderDefaultsToCommuting() {
        // H3: 0 -5- 1 -3- 2
        CoxeterMatrix h3 = new CoxeterMatrix.Builder(3).order(0, 1, 5).order(1, 2, 3).build();
        assertArrayEquals(new int[][]{ { 1, 5, 2 }, { 5, 1, 3 }, { 2, 3, 1 } }, h3.toArray());
        assertEquals(3, h3.dim());
        assertEquals(5, h3.order(1, 0));
        assertEquals(CoxeterMatrix.of(new int[][]{ { 1, 5, 2 }, { 5, 1, 3 }, { 2, 3, 1 } }), h3);
    }

    @Test
    public void testInfiniteOrder() {
        CoxeterMatrix m = new CoxeterMatrix.Builder(2).infinite(0, 1).build();
        assertFalse(m.isFinite(0, 1));
        assertTrue(m.isFinite(0, 0));
        assertEquals(CoxeterMatrix.INFINITE, m.order(1, 0));
    }

    @Test
    public void testRejectsInvalidEntries() {
        InvalidCoxeterEntryException e = assertThrows(InvalidCoxeterEntryException.class,
                () -> CoxeterMatrix.of(new int[][]{ { 1, 1 }, { 1, 1 } }));
        assertEquals(1, e.getRow());
        assertEquals(0, e.getCol());
        assertThrows(InvalidCoxeterEntryException.class, () -> CoxeterMatrix.of(new int[][]{ { 1, -3 }, { -3, 1 } }));
        assertThrows(InvalidCoxeterEntryException.class, () -> CoxeterMatrix.of(new int[][]{ { 1, 3 }, { 4, 1 } }));
        assertThrows(InvalidCoxeterEntryException.class, () -> CoxeterMatrix.of(new int[][]{ { 2, 3 }, { 3, 1 } }));
        assertThrows(InvalidCoxeterEntryException.class, () -> new CoxeterMatrix.Builder(2).order(0, 1, 1));
        assertThrows(InvalidCoxeterEntryException.class, () -> new CoxeterMatrix.Builder(2).order(1, 1, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> new CoxeterMatrix.Builder(2).order(0, 2, 3));
    }

    @Test
    public void testRejectsBadShape() {
        assertThrows(IllegalArgumentException.class, () -> CoxeterMatrix.of(new int[0][0]));
        assertThrows(IllegalArgumentException.class, () -> CoxeterMatrix.of(new int[][]{ { 1, 2 }, { 2 } }));
        assertThrows(IllegalArgumentException.class, () -> new CoxeterMatrix.Builder(0));
    }

    @Test
    public void testInputIsCopied() {
        int[][] raw = { { 1, 3 }, { 3, 1 } };
        CoxeterMatrix m = CoxeterMatrix.of(raw);
        raw[0][1] = 7;
        assertEquals(3, m.order(0, 1));
        m.toArray()[0][1] = 7;
        assertEquals(3, m.order(0, 1));
    }
}
