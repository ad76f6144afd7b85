package org.qwed.engine.logic;

import org.qwed.compiler.CompiledConstraint;
import org.qwed.compiler.ConstraintCompiler;
import org.qwed.core.Artifact;
import org.qwed.core.LogicGoal;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.EngineResult;
import org.qwed.engine.EngineStatus;
import org.qwed.engine.FailureDetail;
import org.qwed.engine.SolverDetail;
import org.qwed.errors.SolverTimeoutException;
import org.qwed.symbolic.Satisfiability;
import org.qwed.symbolic.SolverAdapter;
import org.qwed.symbolic.SolverOutcome;
import org.qwed.symbolic.SolverSession;
import org.qwed.symbolic.Z3SolverAdapter;
import org.qwed.symbolic.Z3VariableManager;
import org.qwed.validation.ValidatedExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LogicEngineTest {

    private final VerificationConfig config = VerificationConfig.defaults();

    private CountingAdapter adapter;
    private CountingCompiler compiler;
    private LogicEngine engine;

    /**
     * 记录打开的会话数和 check 调用次数。
     */
    static final class CountingAdapter implements SolverAdapter {
        private final SolverAdapter delegate;
        final AtomicInteger sessions = new AtomicInteger();
        final AtomicInteger checks = new AtomicInteger();

        CountingAdapter(SolverAdapter delegate) {
            this.delegate = delegate;
        }

        @Override
        public SolverSession openSession() {
            sessions.incrementAndGet();
            SolverSession session = delegate.openSession();
            return new SolverSession() {
                @Override
                public Z3VariableManager variables() {
                    return session.variables();
                }

                @Override
                public SolverOutcome check(CompiledConstraint constraint) {
                    checks.incrementAndGet();
                    return session.check(constraint);
                }

                @Override
                public void close() {
                    session.close();
                }
            };
        }
    }

    static final class CountingCompiler extends ConstraintCompiler {
        final AtomicInteger calls = new AtomicInteger();

        CountingCompiler() {
            super(8, 64);
        }

        @Override
        public CompiledConstraint compile(ValidatedExpression expression, Z3VariableManager variables) {
            calls.incrementAndGet();
            return super.compile(expression, variables);
        }
    }

    @BeforeEach
    void setUp() {
        adapter = new CountingAdapter(new Z3SolverAdapter(config.getSolverTimeoutMillis()));
        compiler = new CountingCompiler();
        engine = new LogicEngine(config, adapter, compiler);
    }

    private static SolverDetail solverDetail(EngineResult result) {
        return assertInstanceOf(SolverDetail.class, result.getDetail());
    }

    private static FailureDetail failureDetail(EngineResult result) {
        return assertInstanceOf(FailureDetail.class, result.getDetail());
    }

    @Nested
    @DisplayName("可满足性")
    class SatisfiabilityTests {

        @Test
        @DisplayName("可满足的约束：VERIFIED，模型满足约束")
        void testVerify_Sat() {
            EngineResult result = engine.verify(Artifact.logic("(AND (GT x 5) (LT y 10))"));

            SolverDetail detail = solverDetail(result);
            assertAll(
                    () -> assertEquals(EngineStatus.VERIFIED, result.getStatus()),
                    () -> assertEquals(1.0, result.getConfidence()),
                    () -> assertEquals(Satisfiability.SAT, detail.getSatisfiability()),
                    () -> assertTrue(Long.parseLong(detail.getModel().get("x")) > 5),
                    () -> assertTrue(Long.parseLong(detail.getModel().get("y")) < 10),
                    () -> assertTrue(detail.getSmtLib().contains("declare-const x"))
            );
        }

        @Test
        @DisplayName("矛盾的约束：FAILED，置信度 1")
        void testVerify_Unsat() {
            EngineResult result = engine.verify(Artifact.logic("(AND (GT x 10) (LT x 5))"));

            assertAll(
                    () -> assertEquals(EngineStatus.FAILED, result.getStatus()),
                    () -> assertEquals(1.0, result.getConfidence()),
                    () -> assertEquals(Satisfiability.UNSAT, solverDetail(result).getSatisfiability())
            );
        }

        @Test
        @DisplayName("量词约束")
        void testVerify_Quantifier() {
            EngineResult result = engine.verify(Artifact.logic("(EXISTS k (AND (GT k 3) (LT k 5)))"));

            assertEquals(EngineStatus.VERIFIED, result.getStatus());
        }
    }

    @Nested
    @DisplayName("有效性")
    class ValidityTests {

        @Test
        @DisplayName("恒真式：VERIFIED")
        void testVerify_Valid() {
            EngineResult result = engine.verify(Artifact.logic("(IMPLIES (GT x 5) (GT x 3))", LogicGoal.VALID));

            assertEquals(EngineStatus.VERIFIED, result.getStatus());
        }

        @Test
        @DisplayName("非恒真式：FAILED，模型即反例")
        void testVerify_NotValid() {
            EngineResult result = engine.verify(Artifact.logic("(IMPLIES (GT x 3) (GT x 5))", LogicGoal.VALID));

            long x = Long.parseLong(solverDetail(result).getModel().get("x"));
            assertAll(
                    () -> assertEquals(EngineStatus.FAILED, result.getStatus()),
                    () -> assertTrue(x > 3 && x <= 5, "反例 x = " + x)
            );
        }
    }

    @Nested
    @DisplayName("算术声称")
    class ClaimTests {

        @Test
        @DisplayName("正确的声称：VERIFIED")
        void testVerify_CorrectClaim() {
            EngineResult result = engine.verify(Artifact.arithmetic("(MULT 2 (PLUS 5 10))", "30"));

            assertEquals(EngineStatus.VERIFIED, result.getStatus());
        }

        @Test
        @DisplayName("错误的声称：FAILED，给出实际值")
        void testVerify_WrongClaim() {
            EngineResult result = engine.verify(Artifact.arithmetic("(MULT 2 (PLUS 5 10))", "31"));

            assertAll(
                    () -> assertEquals(EngineStatus.FAILED, result.getStatus()),
                    () -> assertEquals("30", solverDetail(result).getObserved().get(ConstraintCompiler.OBSERVED_VALUE))
            );
        }

        @Test
        @DisplayName("实数声称在容差内成立")
        void testVerify_RealClaimWithinTolerance() {
            EngineResult result = engine.verify(Artifact.arithmetic("(DIV 1.0 3)", "0.3333333333"));

            assertEquals(EngineStatus.VERIFIED, result.getStatus());
        }

        @Test
        @DisplayName("非数字的声称值：ERROR，不会拼接进表达式")
        void testVerify_MaliciousClaim() {
            EngineResult result = engine.verify(Artifact.arithmetic("(PLUS 1 1)", "2) (OR true"));

            assertAll(
                    () -> assertEquals(EngineStatus.ERROR, result.getStatus()),
                    () -> assertEquals("PARSE_ERROR", failureDetail(result).getCode()),
                    () -> assertEquals(0, adapter.sessions.get())
            );
        }
    }

    @Nested
    @DisplayName("错误输入")
    class ErrorTests {

        @Test
        @DisplayName("未知运算符：ERROR，编译器从未被调用")
        void testVerify_UnknownOperator() {
            EngineResult result = engine.verify(Artifact.logic("(AND (EXEC x) true)"));

            assertAll(
                    () -> assertEquals(EngineStatus.ERROR, result.getStatus()),
                    () -> assertEquals(0.0, result.getConfidence()),
                    () -> assertEquals("UNKNOWN_OPERATOR", failureDetail(result).getCode()),
                    () -> assertEquals(0, compiler.calls.get()),
                    () -> assertEquals(0, adapter.checks.get())
            );
        }

        @Test
        @DisplayName("字面量零除数：ERROR，求解器从未被调用")
        void testVerify_DivisionByZero() {
            EngineResult result = engine.verify(Artifact.logic("(GT (DIV x 0) 1)"));

            assertAll(
                    () -> assertEquals(EngineStatus.ERROR, result.getStatus()),
                    () -> assertEquals("DIVISION_BY_ZERO", failureDetail(result).getCode()),
                    () -> assertEquals(1, compiler.calls.get()),
                    () -> assertEquals(0, adapter.checks.get())
            );
        }

        @Test
        @DisplayName("类型冲突：ERROR 并带有位置")
        void testVerify_TypeConflict() {
            EngineResult result = engine.verify(Artifact.logic("(AND x (GT x 1))"));

            FailureDetail detail = failureDetail(result);
            assertAll(
                    () -> assertEquals("TYPE_CONFLICT", detail.getCode()),
                    () -> assertTrue(detail.getPosition().isPresent())
            );
        }

        @Test
        @DisplayName("求解器超时向上抛出，交给调用包装器重试")
        void testVerify_SolverTimeoutPropagates() {
            SolverAdapter timingOut = () -> new SolverSession() {
                private final SolverSession real = new Z3SolverAdapter(1_000).openSession();

                @Override
                public Z3VariableManager variables() {
                    return real.variables();
                }

                @Override
                public SolverOutcome check(CompiledConstraint constraint) {
                    throw new SolverTimeoutException(1_000);
                }

                @Override
                public void close() {
                    real.close();
                }
            };
            LogicEngine slow = new LogicEngine(config, timingOut);

            assertThrows(SolverTimeoutException.class, () -> slow.verify(Artifact.logic("(GT x 1)")));
        }
    }

    @Test
    @DisplayName("同一产物重复验证得到相同的结果")
    void testVerify_Idempotent() {
        Artifact artifact = Artifact.logic("(AND (GT x 10) (LT x 5))");

        assertEquals(engine.verify(artifact), engine.verify(artifact));
    }
}
