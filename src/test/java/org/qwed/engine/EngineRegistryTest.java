package org.qwed.engine;

import org.qwed.core.Artifact;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.arithmetic.ArithmeticEngine;
import org.qwed.engine.code.CodeSafetyEngine;
import org.qwed.engine.logic.LogicEngine;
import org.qwed.engine.sql.SqlSafetyEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class EngineRegistryTest {

    private final VerificationConfig config = VerificationConfig.defaults();

    private static List<String> ids(List<RegisteredEngine> engines) {
        return engines.stream().map(RegisteredEngine::getId).collect(Collectors.toList());
    }

    @Test
    @DisplayName("按产物类型选出适用的引擎，按权重降序")
    void testApplicable_ByKindAndWeight() {
        EngineRegistry registry = EngineRegistry.withDefaultEngines(config, () -> 0L);

        assertAll(
                () -> assertEquals(4, registry.size()),
                () -> assertEquals(List.of(LogicEngine.ID, ArithmeticEngine.ID),
                        ids(registry.applicable(Artifact.arithmetic("(PLUS 1 2)", "3")))),
                () -> assertEquals(List.of(LogicEngine.ID, ArithmeticEngine.ID),
                        ids(registry.applicable(Artifact.logic("(GT 2 1)")))),
                () -> assertEquals(List.of(LogicEngine.ID), ids(registry.applicable(Artifact.logic("(GT x 1)")))),
                () -> assertEquals(List.of(SqlSafetyEngine.ID), ids(registry.applicable(Artifact.sql("SELECT 1")))),
                () -> assertEquals(List.of(CodeSafetyEngine.ID), ids(registry.applicable(Artifact.code("x = 1"))))
        );
    }

    @Test
    @DisplayName("配置中的权重覆盖引擎默认权重")
    void testRegister_WeightOverride() {
        VerificationConfig overridden = VerificationConfig.builder().engineWeight(ArithmeticEngine.ID, 0.5).build();
        EngineRegistry registry = new EngineRegistry(overridden, () -> 0L);

        RegisteredEngine entry = registry.register(new ArithmeticEngine(overridden));

        assertAll(
                () -> assertEquals(0.5, entry.getWeight()),
                () -> assertSame(entry, registry.find(ArithmeticEngine.ID).orElseThrow())
        );
    }

    @Test
    @DisplayName("重复 id 或非法权重被拒绝")
    void testRegister_Rejects() {
        EngineRegistry registry = new EngineRegistry(config, () -> 0L);
        registry.register(new SqlSafetyEngine(config));
        VerificationConfig badWeight = VerificationConfig.builder().engineWeight(CodeSafetyEngine.ID, 1.5).build();

        assertAll(
                () -> assertThrows(IllegalArgumentException.class, () -> registry.register(new SqlSafetyEngine(config))),
                () -> assertThrows(IllegalArgumentException.class, () -> new EngineRegistry(badWeight, () -> 0L))
        );
    }
}
