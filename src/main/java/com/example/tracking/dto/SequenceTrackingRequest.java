package com.example.tracking.dto;

import lombok.Data;

import javax.validation.Valid;
import javax.validation.constraints.NotNull;
import java.util.List;

/**
 * 离线序列跟踪请求：按顺序提交整段视频每一帧的检测结果
 */
@Data
public class SequenceTrackingRequest {

    /** 跟踪参数（可选） */
    @Valid
    private TrackerSettings settings;

    /** 每帧的检测列表 */
    @NotNull(message = "帧列表不能为空")
    private List<List<Detection>> frames;
}
