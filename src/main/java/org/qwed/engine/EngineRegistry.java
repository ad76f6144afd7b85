package org.qwed.engine;

import org.apache.commons.lang3.Validate;
import org.qwed.core.Artifact;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.arithmetic.ArithmeticEngine;
import org.qwed.engine.code.CodeSafetyEngine;
import org.qwed.engine.logic.LogicEngine;
import org.qwed.engine.sql.SqlSafetyEngine;
import org.qwed.resilience.CircuitBreaker;
import org.qwed.symbolic.SolverAdapter;
import org.qwed.symbolic.Z3SolverAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 引擎注册表。每个引擎在注册时获得生效权重（配置覆盖优先）和一个独占的熔断器，
 * 熔断器由注册表项持有，被所有并发请求共享。
 */
public class EngineRegistry {

    private static final Logger logger = LoggerFactory.getLogger(EngineRegistry.class);

    private final VerificationConfig config;
    private final LongSupplier clock;
    private final Map<String, RegisteredEngine> engines = new ConcurrentHashMap<>();

    public EngineRegistry(VerificationConfig config, LongSupplier clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null").validate();
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * 注册逻辑、算术、SQL 和代码四个内置引擎，逻辑引擎使用 Z3。
     */
    public static EngineRegistry withDefaultEngines(VerificationConfig config, LongSupplier clock) {
        return withDefaultEngines(config, clock, new Z3SolverAdapter(config.getSolverTimeoutMillis()));
    }

    public static EngineRegistry withDefaultEngines(VerificationConfig config, LongSupplier clock,
                                                    SolverAdapter solverAdapter) {
        EngineRegistry registry = new EngineRegistry(config, clock);
        registry.register(new LogicEngine(config, solverAdapter));
        registry.register(new ArithmeticEngine(config));
        registry.register(new SqlSafetyEngine(config));
        registry.register(new CodeSafetyEngine(config));
        return registry;
    }

    /**
     * @throws IllegalArgumentException id 重复或权重不在 (0, 1] 内。
     */
    public RegisteredEngine register(VerificationEngine engine) {
        Objects.requireNonNull(engine, "engine cannot be null");
        double weight = config.weightOverride(engine.getId()).orElse(engine.getDefaultWeight());
        Validate.isTrue(weight > 0.0 && weight <= 1.0, "weight of engine %s must be in (0, 1]: %s", engine.getId(), weight);
        RegisteredEngine entry = new RegisteredEngine(engine, weight,
                CircuitBreaker.fromConfig(engine.getId(), config, clock));
        RegisteredEngine existing = engines.putIfAbsent(engine.getId(), entry);
        Validate.isTrue(existing == null, "engine %s is already registered", engine.getId());
        logger.info("注册引擎 {}，权重 {}", engine.getId(), weight);
        return entry;
    }

    /**
     * @return 适用于该产物的引擎，按权重降序、id 升序。
     */
    public List<RegisteredEngine> applicable(Artifact artifact) {
        List<RegisteredEngine> result = new ArrayList<>();
        for (RegisteredEngine entry : engines.values()) {
            if (entry.getEngine().supports(artifact)) {
                result.add(entry);
            }
        }
        result.sort(RegisteredEngine.BY_WEIGHT);
        return result;
    }

    public Optional<RegisteredEngine> find(String engineId) {
        return Optional.ofNullable(engines.get(engineId));
    }

    public int size() {
        return engines.size();
    }
}
