package org.qwed.engine.arithmetic;

import org.qwed.core.Artifact;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.ArithmeticDetail;
import org.qwed.engine.EngineResult;
import org.qwed.engine.EngineStatus;
import org.qwed.engine.FailureDetail;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArithmeticEngineTest {

    private final ArithmeticEngine engine = new ArithmeticEngine(VerificationConfig.defaults());

    @Nested
    @DisplayName("适用范围")
    class SupportsTests {

        @Test
        @DisplayName("算术产物总是适用，逻辑产物只在不含变量时适用")
        void testSupports() {
            assertAll(
                    () -> assertTrue(engine.supports(Artifact.arithmetic("(PLUS 1 2)", "3"))),
                    () -> assertTrue(engine.supports(Artifact.logic("(GT 3 2)"))),
                    () -> assertFalse(engine.supports(Artifact.logic("(GT x 2)"))),
                    () -> assertFalse(engine.supports(Artifact.logic("(GT 3"))),
                    () -> assertFalse(engine.supports(Artifact.sql("SELECT 1")))
            );
        }
    }

    @Nested
    @DisplayName("声称值核对")
    class ClaimTests {

        @Test
        @DisplayName("2 * (5 + 10) = 30")
        void testVerify_Correct() {
            EngineResult result = engine.verify(Artifact.arithmetic("(MULT 2 (PLUS 5 10))", "30"));

            ArithmeticDetail detail = assertInstanceOf(ArithmeticDetail.class, result.getDetail());
            assertAll(
                    () -> assertEquals(EngineStatus.VERIFIED, result.getStatus()),
                    () -> assertEquals("30", detail.getComputedValue())
            );
        }

        @Test
        @DisplayName("错误的声称给出计算值")
        void testVerify_Wrong() {
            EngineResult result = engine.verify(Artifact.arithmetic("(MULT 2 (PLUS 5 10))", "31"));

            ArithmeticDetail detail = assertInstanceOf(ArithmeticDetail.class, result.getDetail());
            assertAll(
                    () -> assertEquals(EngineStatus.FAILED, result.getStatus()),
                    () -> assertEquals(1.0, result.getConfidence()),
                    () -> assertEquals("30", detail.getComputedValue()),
                    () -> assertEquals("31", detail.getClaimedValue())
            );
        }

        @Test
        @DisplayName("整数字面量的除法取整，实数字面量的除法精确")
        void testVerify_DivisionSemantics() {
            assertAll(
                    () -> assertEquals(EngineStatus.VERIFIED,
                            engine.verify(Artifact.arithmetic("(DIV 7 2)", "3")).getStatus()),
                    () -> assertEquals(EngineStatus.VERIFIED,
                            engine.verify(Artifact.arithmetic("(DIV 7.0 2)", "3.5")).getStatus()),
                    () -> assertEquals(EngineStatus.VERIFIED,
                            engine.verify(Artifact.arithmetic("(MOD -7 2)", "1")).getStatus())
            );
        }

        @Test
        @DisplayName("实数结果在容差内视为相等")
        void testVerify_Tolerance() {
            assertAll(
                    () -> assertEquals(EngineStatus.VERIFIED,
                            engine.verify(Artifact.arithmetic("(DIV 1.0 3)", "0.3333333333")).getStatus()),
                    () -> assertEquals(EngineStatus.FAILED,
                            engine.verify(Artifact.arithmetic("(DIV 1.0 3)", "0.33")).getStatus())
            );
        }

        @Test
        @DisplayName("零除数：ERROR(DIVISION_BY_ZERO)")
        void testVerify_DivisionByZero() {
            EngineResult result = engine.verify(Artifact.arithmetic("(DIV 1 (MINUS 2 2))", "0"));

            assertAll(
                    () -> assertEquals(EngineStatus.ERROR, result.getStatus()),
                    () -> assertEquals("DIVISION_BY_ZERO",
                            assertInstanceOf(FailureDetail.class, result.getDetail()).getCode())
            );
        }

        @Test
        @DisplayName("指数超过上限：ERROR(EXPONENT_TOO_LARGE)")
        void testVerify_ExponentTooLarge() {
            EngineResult result = engine.verify(Artifact.arithmetic("(POW 2 100)", "0"));

            assertEquals("EXPONENT_TOO_LARGE", assertInstanceOf(FailureDetail.class, result.getDetail()).getCode());
        }
    }

    @Test
    @DisplayName("不含变量的逻辑产物直接求值")
    void testVerify_GroundFormula() {
        assertAll(
                () -> assertEquals(EngineStatus.VERIFIED, engine.verify(Artifact.logic("(GT (PLUS 2 2) 3)")).getStatus()),
                () -> assertEquals(EngineStatus.FAILED, engine.verify(Artifact.logic("(AND (GT 1 2) true)")).getStatus())
        );
    }
}
