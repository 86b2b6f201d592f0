package com.example.tracking.dto;

import lombok.Data;

import javax.validation.constraints.NotNull;
import java.util.List;

/**
 * 单帧检测提交请求
 */
@Data
public class FrameRequest {

    /** 调用方的帧序号（可选，原样返回） */
    private Integer frameIndex;

    /** 当前帧检测列表，可以为空列表 */
    @NotNull(message = "检测列表不能为空")
    private List<Detection> detections;
}
