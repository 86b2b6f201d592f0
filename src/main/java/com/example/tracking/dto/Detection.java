package com.example.tracking.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

/**
 * 外部检测器输出的单个检测结果
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Detection {

    /** 边界框 [x1, y1, x2, y2] */
    private double[] bbox;

    /** 类别标签 */
    private String classLabel;

    /** 置信度 [0, 1] */
    private double confidence;

    /** 分割掩码（可选，跟踪时不使用） */
    private boolean[][] mask;

    public Detection() {}

    public Detection(double[] bbox, String classLabel, double confidence) {
        this.bbox = bbox;
        this.classLabel = classLabel;
        this.confidence = confidence;
    }
}
