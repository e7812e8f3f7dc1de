package com.rummikub.model;

/**
 * 牌组类型
 */
public enum MeldKind {
    GROUP,  // 组：3-4张同点数、不同颜色
    RUN     // 顺：至少3张同颜色、连续点数
}
