package com.example.tracking.tracker;

/**
 * 跟踪状态，每帧根据 hitStreak 和已处理帧数重新计算
 */
public enum TrackStatus {
    /** 连续命中次数未达到确认阈值 */
    TENTATIVE,
    /** 已确认（或仍处于启动宽限期），会被输出 */
    CONFIRMED
}
