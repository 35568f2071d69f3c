package com.conceptengine.config;

/**
 * 全局常量定义
 * 
 * 包含概念抽取的默认参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 抽取参数 ====================
    /** 默认不输出零长度概念（空序列只记录在根节点上） */
    public static final boolean DEFAULT_EMIT_EMPTY_CONCEPTS = false;
    /** 活跃匹配工作表的默认初始容量 */
    public static final int DEFAULT_INITIAL_ACTIVE_CAPACITY = 16;
}
