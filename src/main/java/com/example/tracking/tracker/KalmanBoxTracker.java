package com.example.tracking.tracker;

import lombok.Getter;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 单目标卡尔曼边界框跟踪器
 * <p>
 * 状态向量: x = [cx, cy, s, r, vx, vy, vs]^T
 * - cx, cy: 中心点坐标
 * - s: 面积
 * - r: 宽高比（视为常量，没有速度分量）
 * - vx, vy, vs: 对应速度
 * <p>
 * 观测向量: z = [cx, cy, s, r]^T
 * <p>
 * 匀速运动模型:
 * F = [1, 0, 0, 0, 1, 0, 0]    H = [1, 0, 0, 0, 0, 0, 0]
 *     [0, 1, 0, 0, 0, 1, 0]        [0, 1, 0, 0, 0, 0, 0]
 *     [0, 0, 1, 0, 0, 0, 1]        [0, 0, 1, 0, 0, 0, 0]
 *     [0, 0, 0, 1, 0, 0, 0]        [0, 0, 0, 1, 0, 0, 0]
 *     [0, 0, 0, 0, 1, 0, 0]
 *     [0, 0, 0, 0, 0, 1, 0]
 *     [0, 0, 0, 0, 0, 0, 1]
 * <p>
 * 除滤波状态外还维护生命周期计数（age / hits / hitStreak / timeSinceUpdate）以及中心点轨迹。
 */
public class KalmanBoxTracker {

    private static final int DIM_X = 7;

    private static final RealMatrix F = MatrixUtils.createRealMatrix(new double[][]{
            {1, 0, 0, 0, 1, 0, 0},
            {0, 1, 0, 0, 0, 1, 0},
            {0, 0, 1, 0, 0, 0, 1},
            {0, 0, 0, 1, 0, 0, 0},
            {0, 0, 0, 0, 1, 0, 0},
            {0, 0, 0, 0, 0, 1, 0},
            {0, 0, 0, 0, 0, 0, 1}
    });

    private static final RealMatrix H = MatrixUtils.createRealMatrix(new double[][]{
            {1, 0, 0, 0, 0, 0, 0},
            {0, 1, 0, 0, 0, 0, 0},
            {0, 0, 1, 0, 0, 0, 0},
            {0, 0, 0, 1, 0, 0, 0}
    });

    // 观测噪声：面积和宽高比比中心点噪声大
    private static final RealMatrix R = MatrixUtils.createRealDiagonalMatrix(
            new double[]{1, 1, 10, 10});

    // 过程噪声：速度项很小
    private static final RealMatrix Q = MatrixUtils.createRealDiagonalMatrix(
            new double[]{1, 1, 1, 1, 0.01, 0.01, 0.0001});

    private static final RealMatrix I = MatrixUtils.createRealIdentityMatrix(DIM_X);

    @Getter
    private final int id;

    private RealVector x;
    private RealMatrix P;

    @Getter
    private int age;
    @Getter
    private int hits;
    @Getter
    private int hitStreak;
    @Getter
    private int timeSinceUpdate;

    private final int historyLength;
    private final Deque<double[]> history = new ArrayDeque<>();

    public KalmanBoxTracker(int id, double[] bbox, int historyLength) {
        this.id = id;
        this.historyLength = historyLength;

        double[] z = BoundingBoxes.toObservation(bbox);
        this.x = MatrixUtils.createRealVector(new double[]{z[0], z[1], z[2], z[3], 0, 0, 0});

        // 位置不确定性适中，初始速度不确定性很高
        this.P = MatrixUtils.createRealDiagonalMatrix(
                new double[]{10, 10, 10, 10, 10000, 10000, 10000});
    }

    /**
     * 预测下一帧位置
     *
     * @return 预测的边界框 [x1, y1, x2, y2]
     */
    public double[] predict() {
        // 防止面积变为负数
        if (x.getEntry(6) + x.getEntry(2) <= 0) {
            x.setEntry(6, 0.0);
        }

        x = F.operate(x);
        P = F.multiply(P).multiply(F.transpose()).add(Q);

        age++;
        if (timeSinceUpdate > 0) {
            hitStreak = 0;
        }
        timeSinceUpdate++;

        return currentBox();
    }

    /**
     * 使用观测框修正状态
     *
     * @param bbox 检测框 [x1, y1, x2, y2]
     */
    public void correct(double[] bbox) {
        timeSinceUpdate = 0;
        hits++;
        hitStreak++;

        RealVector z = MatrixUtils.createRealVector(BoundingBoxes.toObservation(bbox));

        // y = z - H * x
        RealVector y = z.subtract(H.operate(x));

        // S = H * P * H^T + R
        RealMatrix PHt = P.multiply(H.transpose());
        RealMatrix S = H.multiply(PHt).add(R);

        // K = P * H^T * S^-1
        RealMatrix K = PHt.multiply(new LUDecomposition(S).getSolver().getInverse());

        x = x.add(K.operate(y));

        // Joseph 形式: P = (I - KH) P (I - KH)^T + K R K^T
        RealMatrix IKH = I.subtract(K.multiply(H));
        P = IKH.multiply(P).multiply(IKH.transpose())
                .add(K.multiply(R).multiply(K.transpose()));
    }

    /**
     * 当前状态对应的边界框，无副作用
     */
    public double[] currentBox() {
        return BoundingBoxes.fromObservation(x.getEntry(0), x.getEntry(1), x.getEntry(2), x.getEntry(3));
    }

    /**
     * 速度 [vx, vy]（像素/帧）
     */
    public double[] getVelocity() {
        return new double[]{x.getEntry(4), x.getEntry(5)};
    }

    /**
     * 将当前中心点追加到轨迹，超过上限时从头部淘汰
     */
    public void recordCenter() {
        history.addLast(BoundingBoxes.center(currentBox()));
        while (history.size() > historyLength) {
            history.removeFirst();
        }
    }

    public List<double[]> getHistory() {
        List<double[]> copy = new ArrayList<>(history.size());
        for (double[] point : history) {
            copy.add(point.clone());
        }
        return copy;
    }
}
