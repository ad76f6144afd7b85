package org.qwed.consensus;

import org.qwed.core.Artifact;
import org.qwed.engine.EngineResult;
import org.qwed.engine.FailureDetail;
import org.qwed.engine.RegisteredEngine;
import org.qwed.errors.SolverException;
import org.qwed.resilience.CallPermit;
import org.qwed.resilience.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * 一次受熔断器保护的引擎调用。
 * 求解器异常原样重试一次，仍失败才计为熔断失败；输入和编译错误说明产物有问题而不是引擎有问题，计为成功。
 * 调用结果与截止时间取消通过 CAS 竞争：先完成的一方负责向熔断器汇报，被取消的调用从不计入失败窗口。
 */
final class EngineCall implements Callable<EngineResult> {

    private static final Logger logger = LoggerFactory.getLogger(EngineCall.class);

    enum CallState { RUNNING, COMPLETED, CANCELLED }

    private final RegisteredEngine entry;
    private final Artifact artifact;
    private final CallPermit permit;
    private final LongSupplier clock;
    private final AtomicReference<CallState> state = new AtomicReference<>(CallState.RUNNING);

    EngineCall(RegisteredEngine entry, Artifact artifact, CallPermit permit, LongSupplier clock) {
        this.entry = entry;
        this.artifact = artifact;
        this.permit = permit;
        this.clock = clock;
    }

    @Override
    public EngineResult call() {
        long start = clock.getAsLong();
        EngineResult result;
        boolean healthy;
        try {
            result = invokeWithRetry();
            healthy = true;
        } catch (SolverException e) {
            logger.warn("引擎 {} 重试后仍失败 [{}]", entry.getId(), e.getCode());
            result = EngineResult.error(entry.getId(), FailureDetail.of(e));
            healthy = false;
        } catch (RuntimeException e) {
            logger.error("引擎 {} 发生未预期的异常", entry.getId(), e);
            result = EngineResult.error(entry.getId(), FailureDetail.internal(e));
            healthy = false;
        }
        long latency = Math.max(0L, clock.getAsLong() - start);
        complete(healthy);
        return result.withLatency(latency);
    }

    private EngineResult invokeWithRetry() {
        try {
            return entry.getEngine().verify(artifact);
        } catch (SolverException e) {
            logger.warn("引擎 {} 求解失败 [{}]，重试一次", entry.getId(), e.getCode());
            return entry.getEngine().verify(artifact);
        }
    }

    /**
     * 调用以异常结束（例如 Error），由编排器代为汇报失败。
     */
    void completeExceptionally() {
        complete(false);
    }

    private void complete(boolean healthy) {
        if (!state.compareAndSet(CallState.RUNNING, CallState.COMPLETED)) {
            logger.debug("引擎 {} 的调用已被取消，丢弃结果", entry.getId());
            return;
        }
        CircuitBreaker breaker = entry.getCircuitBreaker();
        if (healthy) {
            breaker.onSuccess(permit);
        } else {
            breaker.onFailure(permit);
        }
    }

    /**
     * 截止时间到达时由编排器调用。
     * @return 是否抢在调用完成前取消；为 false 时结果已经可用。
     */
    boolean cancel() {
        if (state.compareAndSet(CallState.RUNNING, CallState.CANCELLED)) {
            entry.getCircuitBreaker().onCancelled(permit);
            return true;
        }
        return false;
    }

    String engineId() {
        return entry.getId();
    }
}
