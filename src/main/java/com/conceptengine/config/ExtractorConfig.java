package com.conceptengine.config;

/**
 * 抽取器运行时配置
 * 
 * 覆盖Constants默认值，在创建抽取器时校验
 */
public class ExtractorConfig {
    private boolean emitEmptyConcepts = Constants.DEFAULT_EMIT_EMPTY_CONCEPTS;
    private int initialActiveCapacity = Constants.DEFAULT_INITIAL_ACTIVE_CAPACITY;

    /**
     * 是否在每个词项位置输出零长度概念。
     * 仅当词典包含空序列时生效。
     */
    public boolean isEmitEmptyConcepts() {
        return emitEmptyConcepts;
    }

    public void setEmitEmptyConcepts(boolean emitEmptyConcepts) {
        this.emitEmptyConcepts = emitEmptyConcepts;
    }

    public int getInitialActiveCapacity() {
        return initialActiveCapacity;
    }

    public void setInitialActiveCapacity(int initialActiveCapacity) {
        this.initialActiveCapacity = initialActiveCapacity;
    }

    /**
     * 校验配置取值。
     *
     * @throws IllegalArgumentException 容量非正数时抛出
     */
    public void validate() {
        if (initialActiveCapacity <= 0) {
            throw new IllegalArgumentException("initialActiveCapacity必须为正数: " + initialActiveCapacity);
        }
    }

    /**
     * 使用默认配置创建实例
     */
    public static ExtractorConfig defaults() {
        return new ExtractorConfig();
    }
}
