package com.hiddenmarkov.util;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class LogMathTest {

    @Test
    void testArgmaxPrefersLowestIndexOnTie() {
        assertEquals(1, LogMath.argmax(new double[] { 0.1, 0.7, 0.7, 0.2 }));
        assertEquals(0, LogMath.argmax(new double[] { 3.0, 3.0 }));
    }

    @Test
    void testArgmaxAllNegativeInfinity() {
        double[] x = { Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY };
        assertEquals(0, LogMath.argmax(x));
    }

    @Test
    void testArgmaxOverSlice() {
        double[] x = { 9.0, 9.0, -1.0, -3.0, -0.5 };
        // slice [2, 5) -> best is -0.5 at relative index 2
        assertEquals(2, LogMath.argmax(x, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> LogMath.argmax(x, 0, 0));
    }

    @Test
    void testLogOfZeroIsNegativeInfinity() {
        double[] logs = LogMath.log(new double[] { 1.0, 0.0, 0.5 });
        assertEquals(0.0, logs[0], 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, logs[1]);
        assertEquals(Math.log(0.5), logs[2], 1e-12);

        double[][] matrixLogs = LogMath.log(new double[][] { { 1.0 }, { 0.25, 0.75 } });
        assertEquals(2, matrixLogs[1].length);
        assertEquals(Math.log(0.75), matrixLogs[1][1], 1e-12);
    }

    @Test
    void testSum() {
        assertEquals(1.0, LogMath.sum(new double[] { 0.25, 0.25, 0.5 }), 1e-12);
        assertEquals(0.0, LogMath.sum(new double[0]), 0.0);
    }
}
