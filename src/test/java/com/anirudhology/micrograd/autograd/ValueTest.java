package com.anirudhology.micrograd.autograd;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    private static final double EPSILON = 1e-9;

    // ============ Forward ============

    @Test
    void leafStartsWithZeroGradientAndNoOperands() {
        Value a = new Value(3.5, "a");
        assertEquals(3.5, a.getData());
        assertEquals(0.0, a.getGradient());
        assertTrue(a.isLeaf());
        assertTrue(a.getOperands().isEmpty());
        assertEquals("a", a.getLabel());
        assertEquals("", a.getOperation());
    }

    @Test
    void primitiveForwardValues() {
        Value a = new Value(3.0);
        Value b = new Value(4.0);
        assertEquals(7.0, a.add(b).getData(), EPSILON);
        assertEquals(12.0, a.multiply(b).getData(), EPSILON);
        assertEquals(81.0, a.pow(4).getData(), EPSILON);
        assertEquals(3.0, a.relu().getData(), EPSILON);
        assertEquals(0.0, new Value(-3.0).relu().getData(), EPSILON);
    }

    @Test
    void derivedForwardValues() {
        Value a = new Value(10.0);
        Value b = new Value(4.0);
        assertEquals(-10.0, a.neg().getData(), EPSILON);
        assertEquals(6.0, a.subtract(b).getData(), EPSILON);
        assertEquals(2.5, a.divide(b).getData(), EPSILON);
        assertEquals(13.0, a.add(3.0).getData(), EPSILON);
        assertEquals(7.0, a.subtract(3.0).getData(), EPSILON);
        assertEquals(30.0, a.multiply(3.0).getData(), EPSILON);
        assertEquals(5.0, a.divide(2.0).getData(), EPSILON);
        assertEquals(-6.0, Value.of(4.0).subtract(a).getData(), EPSILON);
        assertEquals(0.4, Value.of(4.0).divide(a).getData(), EPSILON);
    }

    @Test
    void operandsKeepOperationOrder() {
        Value base = new Value(2.0);
        Value other = new Value(5.0);
        Value product = base.multiply(other);

        assertEquals(List.of(base, other), product.getOperands());
        assertEquals("*", product.getOperation());
        assertEquals(List.of(base), base.pow(3).getOperands());
        assertEquals("^", base.pow(3).getOperation());
        assertEquals("relu", base.relu().getOperation());
        assertEquals("+", base.add(other).getOperation());
    }

    @Test
    void derivedOperationsAreBuiltFromPrimitives() {
        Value a = new Value(6.0);
        Value b = new Value(3.0);

        // a - b = a + (b * -1)
        Value difference = a.subtract(b);
        assertEquals("+", difference.getOperation());
        assertSame(a, difference.getOperands().get(0));
        assertEquals("*", difference.getOperands().get(1).getOperation());

        // a / b = a * b^-1
        Value quotient = a.divide(b);
        assertEquals("*", quotient.getOperation());
        assertSame(a, quotient.getOperands().get(0));
        assertEquals("^", quotient.getOperands().get(1).getOperation());
    }

    @Test
    void operandListIsReadOnly() {
        Value sum = new Value(1.0).add(new Value(2.0));
        assertThrows(UnsupportedOperationException.class, () -> sum.getOperands().add(new Value(3.0)));
        assertSame(sum.getOperands(), sum.getOperands(), "operands are returned as stored");
    }

    @Test
    void compoundAssignmentRebindsToNewNode() {
        Value x = new Value(1.0);
        Value before = x;
        x = x.add(new Value(2.0));

        assertNotSame(before, x);
        assertEquals(1.0, before.getData());
        assertTrue(before.isLeaf());
        assertEquals(3.0, x.getData());
    }

    @Test
    void identityIsDistinctFromValue() {
        Value a = new Value(1.0);
        Value b = new Value(1.0);
        assertNotEquals(a.getId(), b.getId());
        assertNotEquals(a, b);
    }

    @Test
    void readingDataDoesNotChangeIt() {
        Value y = new Value(2.0).multiply(new Value(3.0)).add(1.0);
        assertEquals(7.0, y.getData());
        assertEquals(7.0, y.getData());
        assertEquals(0.0, y.getGradient());
    }

    @Test
    void sumFoldsLeftToRight() {
        Value a = new Value(1.0);
        Value b = new Value(2.0);
        Value c = new Value(3.0);
        Value total = Value.sum(List.of(a, b, c));

        assertEquals(6.0, total.getData(), EPSILON);
        total.backward();
        assertEquals(1.0, a.getGradient(), EPSILON);
        assertEquals(1.0, b.getGradient(), EPSILON);
        assertEquals(1.0, c.getGradient(), EPSILON);
    }

    @Test
    void sumOfSingleValueIsThatValue() {
        Value a = new Value(4.0);
        assertSame(a, Value.sum(List.of(a)));
    }

    @Test
    void sumOfNothingIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> Value.sum(List.of()));
    }

    // ============ Backward, per primitive ============

    @Test
    void addBackward() {
        Value a = new Value(3.0);
        Value b = new Value(-4.0);
        a.add(b).backward();
        assertEquals(1.0, a.getGradient(), EPSILON, "d(a+b)/da = 1");
        assertEquals(1.0, b.getGradient(), EPSILON, "d(a+b)/db = 1");
    }

    @Test
    void multiplyBackward() {
        Value a = new Value(3.0);
        Value b = new Value(4.0);
        a.multiply(b).backward();
        assertEquals(4.0, a.getGradient(), EPSILON, "d(a*b)/da = b");
        assertEquals(3.0, b.getGradient(), EPSILON, "d(a*b)/db = a");
    }

    @Test
    void powBackward() {
        Value a = new Value(3.0);
        a.pow(3).backward();
        assertEquals(27.0, a.getGradient(), EPSILON, "d(a^3)/da = 3a^2");
    }

    @Test
    void powWithFractionalExponent() {
        Value a = new Value(4.0);
        Value root = a.pow(0.5);
        root.backward();
        assertEquals(2.0, root.getData(), EPSILON);
        assertEquals(0.25, a.getGradient(), EPSILON, "d(sqrt a)/da = 1/(2 sqrt a)");
    }

    @Test
    void reluBackwardPassesGradientWhenPositive() {
        Value a = new Value(2.0);
        a.relu().multiply(5.0).backward();
        assertEquals(5.0, a.getGradient(), EPSILON);
    }

    @Test
    void reluBackwardBlocksGradientWhenNegative() {
        Value a = new Value(-2.0);
        a.relu().multiply(5.0).backward();
        assertEquals(0.0, a.getGradient(), EPSILON);
    }

    @Test
    void reluBackwardAtZeroIsZero() {
        Value a = new Value(0.0);
        Value out = a.relu();
        out.backward();
        assertEquals(0.0, out.getData());
        assertEquals(0.0, a.getGradient());
    }

    @Test
    void negBackward() {
        Value a = new Value(5.0);
        a.neg().backward();
        assertEquals(-1.0, a.getGradient(), EPSILON);
    }

    @Test
    void subtractBackward() {
        Value a = new Value(7.0);
        Value b = new Value(3.0);
        a.subtract(b).backward();
        assertEquals(1.0, a.getGradient(), EPSILON, "d(a-b)/da = 1");
        assertEquals(-1.0, b.getGradient(), EPSILON, "d(a-b)/db = -1");
    }

    @Test
    void divideBackward() {
        Value a = new Value(10.0);
        Value b = new Value(4.0);
        a.divide(b).backward();
        assertEquals(0.25, a.getGradient(), EPSILON, "d(a/b)/da = 1/b");
        assertEquals(-10.0 / 16.0, b.getGradient(), EPSILON, "d(a/b)/db = -a/b^2");
    }

    @Test
    void constantOnTheLeftBackward() {
        Value a = new Value(2.0);
        Value.of(10.0).divide(a).backward();
        assertEquals(-2.5, a.getGradient(), EPSILON, "d(10/a)/da = -10/a^2");
    }

    // ============ Numeric edge cases are not guarded ============

    @Test
    void zeroToNegativePowerIsInfinite() {
        Value zero = new Value(0.0);
        Value out = zero.pow(-1);
        out.backward();
        assertEquals(Double.POSITIVE_INFINITY, out.getData());
        assertTrue(Double.isInfinite(zero.getGradient()) || Double.isNaN(zero.getGradient()));
    }

    @Test
    void divisionByZeroValuedNodeIsNotAnError() {
        Value out = new Value(1.0).divide(new Value(0.0));
        assertEquals(Double.POSITIVE_INFINITY, out.getData());
    }

    @Test
    void negativeBaseWithFractionalExponentIsNaN() {
        assertTrue(Double.isNaN(new Value(-4.0).pow(0.5).getData()));
    }

    // ============ Parameter mutation ============

    @Test
    void setDataOverwritesInPlace() {
        Value w = new Value(1.0, "w");
        Value derived = w.multiply(2.0);
        w.setData(3.0);

        assertEquals(3.0, w.getData());
        assertEquals(2.0, derived.getData(), "derived nodes keep their forward result");
    }

    @Test
    void zeroGradientResets() {
        Value a = new Value(2.0);
        a.multiply(3.0).backward();
        assertEquals(3.0, a.getGradient(), EPSILON);
        a.zeroGradient();
        assertEquals(0.0, a.getGradient());
    }
}
