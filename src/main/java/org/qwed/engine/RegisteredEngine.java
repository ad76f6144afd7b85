package org.qwed.engine;

import lombok.Getter;
import org.qwed.resilience.CircuitBreaker;

import java.util.Comparator;
import java.util.Objects;

/**
 * 注册表中的一项：引擎、生效的权重以及它独占的熔断器。
 */
@Getter
public final class RegisteredEngine {

    /** 权重降序，相同权重按 id 升序。 */
    public static final Comparator<RegisteredEngine> BY_WEIGHT =
            Comparator.comparingDouble(RegisteredEngine::getWeight).reversed()
                    .thenComparing(RegisteredEngine::getId);

    private final VerificationEngine engine;
    private final double weight;
    private final CircuitBreaker circuitBreaker;

    RegisteredEngine(VerificationEngine engine, double weight, CircuitBreaker circuitBreaker) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.weight = weight;
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker cannot be null");
    }

    public String getId() {
        return engine.getId();
    }

    @Override
    public String toString() {
        return getId() + "(" + weight + ", " + circuitBreaker.getState() + ")";
    }
}
