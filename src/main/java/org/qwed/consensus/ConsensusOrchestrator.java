package org.qwed.consensus;

import org.apache.commons.lang3.tuple.Pair;
import org.qwed.core.Artifact;
import org.qwed.core.VerificationConfig;
import org.qwed.core.VerificationMode;
import org.qwed.engine.EngineRegistry;
import org.qwed.engine.EngineResult;
import org.qwed.engine.EngineStatus;
import org.qwed.engine.FailureDetail;
import org.qwed.engine.RegisteredEngine;
import org.qwed.resilience.CallPermit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * 共识编排器：选出适用的引擎，经熔断器并发调用，在请求截止时间内收集结果并加权投票。
 * <p>
 * 引擎之间没有顺序保证，投票只依赖按 id 排序后的结果集合。截止时间到达时未完成的调用被取消
 * 并记为 TIMEOUT，不参与投票。编排层的问题从不抛出，而是以降级判定返回。
 */
public class ConsensusOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConsensusOrchestrator.class);

    private final EngineRegistry registry;
    private final VerificationConfig config;
    private final LongSupplier clock;
    private final ExecutorService executor;

    public ConsensusOrchestrator(EngineRegistry registry, VerificationConfig config, LongSupplier clock) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null").validate();
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.executor = Executors.newFixedThreadPool(config.getEngineThreads(), new EngineThreadFactory());
    }

    /**
     * 使用系统时钟和内置引擎。
     */
    public static ConsensusOrchestrator withDefaults(VerificationConfig config) {
        LongSupplier clock = System::currentTimeMillis;
        return new ConsensusOrchestrator(EngineRegistry.withDefaultEngines(config, clock), config, clock);
    }

    public ConsensusVerdict verify(Artifact artifact, VerificationMode mode) {
        return verify(new VerificationRequest(artifact, mode));
    }

    public ConsensusVerdict verify(VerificationRequest request) {
        List<RegisteredEngine> selected = select(request);
        if (selected.isEmpty()) {
            logger.warn("没有适用于 {} 的引擎", request.getArtifact().getKind());
            return new ConsensusVerdict(request.getMode(), EngineStatus.FAILED, 0.0, Agreement.SPLIT,
                    List.of(), Set.of(OrchestratorIssue.NO_APPLICABLE_ENGINE));
        }

        long deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getRequestDeadlineMillis());
        Map<String, EngineResult> results = new LinkedHashMap<>();
        Map<EngineCall, Future<EngineResult>> inFlight = new LinkedHashMap<>();
        for (RegisteredEngine entry : selected) {
            Optional<CallPermit> permit = entry.getCircuitBreaker().tryAcquire();
            if (permit.isEmpty()) {
                logger.warn("引擎 {} 熔断中，短路返回", entry.getId());
                results.put(entry.getId(), EngineResult.error(entry.getId(), FailureDetail.circuitOpen()));
                continue;
            }
            EngineCall call = new EngineCall(entry, request.getArtifact(), permit.get(), clock);
            inFlight.put(call, executor.submit(call));
        }

        boolean interrupted = false;
        for (Map.Entry<EngineCall, Future<EngineResult>> pending : inFlight.entrySet()) {
            EngineCall call = pending.getKey();
            Future<EngineResult> future = pending.getValue();
            if (interrupted) {
                results.put(call.engineId(), cancel(call, future));
                continue;
            }
            try {
                long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
                results.put(call.engineId(), future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                results.put(call.engineId(), cancel(call, future));
            } catch (ExecutionException e) {
                logger.error("引擎 {} 的调用异常结束", call.engineId(), e.getCause());
                call.completeExceptionally();
                results.put(call.engineId(), EngineResult.error(call.engineId(), FailureDetail.internal(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                results.put(call.engineId(), cancel(call, future));
            }
        }

        return aggregate(request, selected, results);
    }

    private List<RegisteredEngine> select(VerificationRequest request) {
        List<RegisteredEngine> applicable = registry.applicable(request.getArtifact());
        int limit = Math.min(applicable.size(), request.getMode().getEngineCount());
        return new ArrayList<>(applicable.subList(0, limit));
    }

    /**
     * 截止时间到达：抢先取消则记为超时，否则结果已经就绪。
     */
    private EngineResult cancel(EngineCall call, Future<EngineResult> future) {
        if (call.cancel()) {
            future.cancel(true);
            logger.warn("引擎 {} 未在 {}ms 内返回，已取消", call.engineId(), config.getRequestDeadlineMillis());
            return EngineResult.timeout(call.engineId(), config.getRequestDeadlineMillis());
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            return EngineResult.error(call.engineId(), FailureDetail.internal(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // 调用已完成并汇报过熔断器，这里只是拿不到结果
            return EngineResult.timeout(call.engineId(), config.getRequestDeadlineMillis());
        }
    }

    private ConsensusVerdict aggregate(VerificationRequest request, List<RegisteredEngine> selected,
                                       Map<String, EngineResult> results) {
        List<RegisteredEngine> ordered = new ArrayList<>(selected);
        ordered.sort(Comparator.comparing(RegisteredEngine::getId));
        List<Pair<EngineResult, Double>> votes = new ArrayList<>(ordered.size());
        Set<OrchestratorIssue> issues = EnumSet.noneOf(OrchestratorIssue.class);
        for (RegisteredEngine entry : ordered) {
            EngineResult result = results.get(entry.getId());
            if (result.getStatus() == EngineStatus.TIMEOUT) {
                issues.add(OrchestratorIssue.REQUEST_DEADLINE_EXCEEDED);
            }
            votes.add(Pair.of(result, entry.getWeight()));
        }
        WeightedVote vote = WeightedVote.tally(votes, config.getMajorityThreshold());
        ConsensusVerdict verdict = new ConsensusVerdict(request.getMode(), vote.getFinalStatus(),
                vote.getConfidence(), vote.getAgreement(), results.values(), issues);
        if (vote.getAgreement() == Agreement.SPLIT || verdict.isDegraded()) {
            logger.warn("降级判定: {}", verdict);
        } else {
            logger.info("判定: {} ({}, 置信度 {})", verdict.getFinalStatus(), verdict.getAgreement(),
                    verdict.getAggregateConfidence());
        }
        return verdict;
    }

    @Override
    public void close() {
        executor.shutdownNow();
        logger.info("共识编排器已关闭");
    }

    private static final class EngineThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "qwed-engine-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
