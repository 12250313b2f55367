package com.coxeter;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link AlgebraicInteger} and {@link CyclotomicField}: exact
 * ring arithmetic and the identities satisfied by roots of unity.
 */
public class AlgebraicIntegerTest {

    @Test
    public void testGaussianIntegers() {
        CyclotomicField f = CyclotomicField.of(4);
        AlgebraicInteger i = f.rootPower(1);
        assertEquals(f.element(-1), i.multiply(i));
        // (1 + i)(1 - i) = 2
        assertEquals(f.element(2), f.one().add(i).multiply(f.one().subtract(i)));
        // i + i^3 = 0
        assertTrue(i.add(f.rootPower(3)).isZero());
    }

    @Test
    public void testRootOfUnityHasExactOrder() {
        CyclotomicField f = CyclotomicField.of(84);
        assertEquals(24, f.degree());
        AlgebraicInteger z = f.rootPower(1);
        AlgebraicInteger p = f.one();
        for (int k = 1; k < 84; k++) {
            p = p.multiply(z);
            assertNotEquals(f.one(), p, "z^" + k);
        }
        assertEquals(f.one(), p.multiply(z));
        assertEquals(f.rootPower(83), f.rootPower(-1));
    }

    @Test
    public void testGoldenRatio() {
        // z + 1/z for z a primitive 10th root of unity is 2cos(pi/5), the golden ratio g
        CyclotomicField f = CyclotomicField.of(10);
        AlgebraicInteger g = f.rootPower(1).add(f.rootPower(-1));
        assertEquals(g.add(f.one()), g.multiply(g));
        assertFalse(g.isRationalInteger());
    }

    @Test
    public void testSquareRootOfTwo() {
        CyclotomicField f = CyclotomicField.of(8);
        AlgebraicInteger s = f.rootPower(1).add(f.rootPower(7));
        AlgebraicInteger sq = s.multiply(s);
        assertTrue(sq.isRationalInteger());
        assertEquals(BigInteger.TWO, sq.rationalPart());
    }

    @Test
    public void testRawVectorReduction() {
        CyclotomicField f = CyclotomicField.of(6);
        // z^3 = -1 in the 6th field
        int[] raw = new int[6];
        raw[3] = 1;
        assertEquals(f.element(-1), f.element(raw));
        // a vector already reduced to the degree is taken as is
        assertEquals(f.rootPower(1), f.element(0, 1));
        assertEquals(BigInteger.ONE, f.element(0, 1).coefficient(1));
    }

    @Test
    public void testRationalIntegers() {
        CyclotomicField f = CyclotomicField.of(14);
        AlgebraicInteger seven = f.element(7);
        assertTrue(seven.isRationalInteger());
        assertEquals(BigInteger.valueOf(7), seven.rationalPart());
        assertEquals(f.element(-7), seven.negate());
        assertEquals(f.element(21), seven.multiply(f.element(3)));
        assertEquals(f.element(4), seven.subtract(f.element(3)));
        assertTrue(f.zero().isZero());
        assertEquals("7", seven.toString());
        assertEquals("0", f.zero().toString());
    }

    @Test
    public void testFieldEquality() {
        assertEquals(CyclotomicField.of(84), CyclotomicField.of(84));
        assertEquals(CyclotomicField.of(84).hashCode(), CyclotomicField.of(84).hashCode());
        assertNotEquals(CyclotomicField.of(6), CyclotomicField.of(3));
        assertEquals(CyclotomicField.of(12).element(5), CyclotomicField.of(12).element(5));
        assertNotEquals(CyclotomicField.of(12).element(5), CyclotomicField.of(6).element(5));
        assertThrows(IllegalArgumentException.class, () -> CyclotomicField.of(0));
    }

    @Test
    public void testFieldHashDependsOnIndexOnly() {
        CyclotomicField f = CyclotomicField.of(84);
        assertEquals(Integer.hashCode(84), f.hashCode());
        assertEquals(f.element(3).hashCode(), CyclotomicField.of(84).element(3).hashCode());
        assertNotEquals(f.element(3).hashCode(), f.element(4).hashCode());
    }

    @Test
    public void testMixingFieldsThrows() {
        AlgebraicInteger a = CyclotomicField.of(6).one();
        AlgebraicInteger b = CyclotomicField.of(8).one();
        assertThrows(IncompatibleFieldException.class, () -> a.add(b));
        assertThrows(IncompatibleFieldException.class, () -> a.subtract(b));
        assertThrows(IncompatibleFieldException.class, () -> a.multiply(b));
    }

    @Test
    public void testImmutability() {
        CyclotomicField f = CyclotomicField.of(5);
        AlgebraicInteger z = f.rootPower(1);
        AlgebraicInteger w = f.rootPower(2);
        AlgebraicInteger sum = z.add(w);
        assertEquals(f.rootPower(1), z);
        assertEquals(f.rootPower(2), w);
        assertEquals(f.rootPower(1).add(f.rootPower(2)), sum);
    }
}
