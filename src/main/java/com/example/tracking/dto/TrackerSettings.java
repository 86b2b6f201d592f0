package com.example.tracking.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;

/**
 * 跟踪参数（请求用），未填写的字段使用服务默认值
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackerSettings {

    /** 最大未匹配帧数 */
    @Min(value = 0, message = "maxAge不能为负数")
    private Integer maxAge;

    /** 确认所需连续命中次数 */
    @Min(value = 0, message = "minHits不能为负数")
    private Integer minHits;

    /** IoU匹配阈值 */
    @DecimalMin(value = "0.0", message = "IoU阈值不能小于0")
    @DecimalMax(value = "1.0", message = "IoU阈值不能大于1")
    private Double iouThreshold;

    /** 轨迹点上限 */
    @Min(value = 1, message = "historyLength必须大于0")
    private Integer historyLength;
}
