package com.tutor.common.dto;

import java.util.List;

/**
 * 等级体系：英语 CET 与日语 JLPT，各自按由易到难排列。
 * <p>
 * 跨体系的等级比较一律无效。
 */
public enum LevelFamily {

    CET(List.of("CET-4", "CET-5", "CET-6"), 0.3),
    JLPT(List.of("N5", "N4", "N3", "N2", "N1"), 0.2);

    private final List<String> levels;

    /** 等级距离衰减步长：每相差一级扣减的适配度 */
    private final double distanceStep;

    LevelFamily(List<String> levels, double distanceStep) {
        this.levels = levels;
        this.distanceStep = distanceStep;
    }

    /** 由易到难的等级列表 */
    public List<String> getLevels() {
        return levels;
    }

    public double getDistanceStep() {
        return distanceStep;
    }

    public boolean contains(String level) {
        return level != null && levels.contains(level);
    }

    /** 等级序号，不属于本体系时返回 -1 */
    public int indexOf(String level) {
        return level == null ? -1 : levels.indexOf(level);
    }

    /**
     * 两个等级之间的距离衰减分：{@code max(0, 1 - |Δ| × step)}。
     * 任一等级不属于本体系时返回 0.5。
     */
    public double distanceScore(String assignedLevel, String targetLevel) {
        int assigned = indexOf(assignedLevel);
        int target = indexOf(targetLevel);
        if (assigned < 0 || target < 0) {
            return 0.5;
        }
        return Math.max(0.0, 1.0 - Math.abs(assigned - target) * distanceStep);
    }
}
