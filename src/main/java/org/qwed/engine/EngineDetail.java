package org.qwed.engine;

/**
 * 引擎特有的结果载荷。实现类都是不可变的值对象。
 */
public interface EngineDetail {

    /**
     * 一行摘要，用于日志。不包含原始产物文本。
     */
    String summary();
}
