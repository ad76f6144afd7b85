package org.qwed.engine;

import org.qwed.core.Artifact;

/**
 * 确定性验证引擎的统一契约。
 * 实现必须是线程安全的：同一个引擎实例会被并发请求同时调用。
 */
public interface VerificationEngine {

    /**
     * 稳定的引擎标识，用于排序、配置权重和熔断器。
     */
    String getId();

    /**
     * 静态可靠性权重，取值 (0, 1]。
     */
    double getDefaultWeight();

    boolean supports(Artifact artifact);

    /**
     * 验证一个产物。输入错误和编译错误转换为 ERROR 结果返回。
     * @throws org.qwed.errors.SolverException 求解器超时或内部错误，由调用包装器重试。
     */
    EngineResult verify(Artifact artifact);
}
