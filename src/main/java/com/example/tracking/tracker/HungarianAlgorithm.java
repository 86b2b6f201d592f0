package com.example.tracking.tracker;

import java.util.Arrays;

/**
 * 匈牙利算法（最短增广路 / 势函数形式）
 * <p>
 * 求解矩形代价矩阵的最小代价一对一分配，共分配 min(行数, 列数) 对，复杂度 O(n^2 * m)。
 */
public final class HungarianAlgorithm {

    private HungarianAlgorithm() {
    }

    /**
     * 最小化总代价
     *
     * @param costMatrix 代价矩阵 [rows][cols]，元素须为有限值
     * @return 每行分配到的列下标，未分配为 -1
     */
    public static int[] solve(double[][] costMatrix) {
        int rows = costMatrix.length;
        if (rows == 0) {
            return new int[0];
        }
        int cols = costMatrix[0].length;
        if (cols == 0) {
            int[] none = new int[rows];
            Arrays.fill(none, -1);
            return none;
        }

        // 行数不能超过列数，否则转置后求解
        if (rows > cols) {
            double[][] transposed = new double[cols][rows];
            for (int i = 0; i < rows; i++) {
                for (int j = 0; j < cols; j++) {
                    transposed[j][i] = costMatrix[i][j];
                }
            }
            int[] colToRow = solveRowsNotExceedingCols(transposed);
            int[] result = new int[rows];
            Arrays.fill(result, -1);
            for (int j = 0; j < cols; j++) {
                if (colToRow[j] >= 0) {
                    result[colToRow[j]] = j;
                }
            }
            return result;
        }
        return solveRowsNotExceedingCols(costMatrix);
    }

    private static int[] solveRowsNotExceedingCols(double[][] a) {
        int n = a.length;
        int m = a[0].length;

        // 下标从1开始，0号列作为虚拟起点
        double[] u = new double[n + 1];
        double[] v = new double[m + 1];
        int[] p = new int[m + 1];
        int[] way = new int[m + 1];

        for (int i = 1; i <= n; i++) {
            p[0] = i;
            int j0 = 0;
            double[] minv = new double[m + 1];
            Arrays.fill(minv, Double.POSITIVE_INFINITY);
            boolean[] used = new boolean[m + 1];

            do {
                used[j0] = true;
                int i0 = p[j0];
                double delta = Double.POSITIVE_INFINITY;
                int j1 = 0;
                for (int j = 1; j <= m; j++) {
                    if (!used[j]) {
                        double cur = a[i0 - 1][j - 1] - u[i0] - v[j];
                        if (cur < minv[j]) {
                            minv[j] = cur;
                            way[j] = j0;
                        }
                        if (minv[j] < delta) {
                            delta = minv[j];
                            j1 = j;
                        }
                    }
                }
                for (int j = 0; j <= m; j++) {
                    if (used[j]) {
                        u[p[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minv[j] -= delta;
                    }
                }
                j0 = j1;
            } while (p[j0] != 0);

            // 沿增广路回溯
            do {
                int j1 = way[j0];
                p[j0] = p[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] result = new int[n];
        Arrays.fill(result, -1);
        for (int j = 1; j <= m; j++) {
            if (p[j] != 0) {
                result[p[j] - 1] = j - 1;
            }
        }
        return result;
    }
}
