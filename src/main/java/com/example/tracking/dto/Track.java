package com.example.tracking.dto;

import com.example.tracking.tracker.TrackStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 某一帧输出的跟踪目标
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class Track {

    /** 跟踪ID，同一跟踪器内唯一且递增 */
    private int id;

    /** 当前边界框 [x1, y1, x2, y2] */
    private double[] bbox;

    /** 本帧匹配检测的类别，未匹配为 unknown */
    private String classLabel;

    /** 本帧匹配检测的置信度，未匹配为 0 */
    private double confidence;

    /** 创建以来经过的帧数 */
    private int age;

    /** 累计匹配次数 */
    private int hits;

    /** 连续匹配次数 */
    private int hitStreak;

    /** 距上次匹配的帧数 */
    private int timeSinceUpdate;

    /** 速度 [vx, vy]（像素/帧） */
    private double[] velocity;

    /** 中心点轨迹，最新的在最后 */
    private List<double[]> history;

    private TrackStatus status;

    /**
     * 速度大小
     */
    public double getSpeed() {
        if (velocity == null) {
            return 0.0;
        }
        return Math.sqrt(velocity[0] * velocity[0] + velocity[1] * velocity[1]);
    }

    /**
     * 边界框中心点
     */
    public double[] getCenter() {
        if (bbox == null) {
            return null;
        }
        return new double[]{(bbox[0] + bbox[2]) / 2.0, (bbox[1] + bbox[3]) / 2.0};
    }
}
