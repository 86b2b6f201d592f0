package com.example.tracking.tracker;

import org.junit.Test;

import java.util.Random;

import static org.junit.Assert.*;

public class HungarianAlgorithmTest {

    @Test
    public void testSquareMatrix() {
        double[][] cost = {
                {4, 1, 3},
                {2, 0, 5},
                {3, 2, 2}
        };
        assertArrayEquals(new int[]{1, 0, 2}, HungarianAlgorithm.solve(cost));
    }

    @Test
    public void testOptimalBeatsGreedy() {
        // 贪心会先取 (0,0)，总IoU 1.0；最优为 (0,1)+(1,0)，总IoU 1.65
        double[][] cost = {
                {-0.9, -0.8},
                {-0.85, -0.1}
        };
        assertArrayEquals(new int[]{1, 0}, HungarianAlgorithm.solve(cost));
    }

    @Test
    public void testWideMatrix() {
        double[][] cost = {
                {10, 1, 10},
                {1, 10, 10}
        };
        assertArrayEquals(new int[]{1, 0}, HungarianAlgorithm.solve(cost));
    }

    @Test
    public void testTallMatrixLeavesOneRowUnassigned() {
        double[][] cost = {
                {10, 1},
                {1, 10},
                {0.5, 5}
        };
        assertArrayEquals(new int[]{1, -1, 0}, HungarianAlgorithm.solve(cost));
    }

    @Test
    public void testEmptyMatrix() {
        assertEquals(0, HungarianAlgorithm.solve(new double[0][0]).length);
        assertArrayEquals(new int[]{-1, -1}, HungarianAlgorithm.solve(new double[2][0]));
    }

    @Test
    public void testMatchesBruteForceOnRandomMatrices() {
        Random random = new Random(42);
        for (int round = 0; round < 50; round++) {
            int n = 4;
            double[][] cost = new double[n][n];
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    cost[i][j] = -random.nextDouble();
                }
            }

            int[] assignment = HungarianAlgorithm.solve(cost);
            double total = 0;
            boolean[] usedCols = new boolean[n];
            for (int i = 0; i < n; i++) {
                assertFalse(usedCols[assignment[i]]);
                usedCols[assignment[i]] = true;
                total += cost[i][assignment[i]];
            }

            assertEquals(bruteForceMinimum(cost, 0, new boolean[n]), total, 1e-9);
        }
    }

    private static double bruteForceMinimum(double[][] cost, int row, boolean[] usedCols) {
        if (row == cost.length) {
            return 0.0;
        }
        double best = Double.POSITIVE_INFINITY;
        for (int j = 0; j < usedCols.length; j++) {
            if (!usedCols[j]) {
                usedCols[j] = true;
                best = Math.min(best, cost[row][j] + bruteForceMinimum(cost, row + 1, usedCols));
                usedCols[j] = false;
            }
        }
        return best;
    }
}
