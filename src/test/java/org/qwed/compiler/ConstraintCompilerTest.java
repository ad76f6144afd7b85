package org.qwed.compiler;

import org.qwed.errors.DivisionByZeroException;
import org.qwed.errors.ExponentTooLargeException;
import org.qwed.errors.UnsupportedConstructException;
import org.qwed.parser.SExpressionParser;
import org.qwed.symbolic.SolverOutcome;
import org.qwed.symbolic.SolverSession;
import org.qwed.symbolic.Z3SolverAdapter;
import org.qwed.utils.Rational;
import org.qwed.validation.AstValidator;
import org.qwed.validation.RootKind;
import org.qwed.validation.ValidatedExpression;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintCompilerTest {

    private final SExpressionParser parser = new SExpressionParser(4096, 32);
    private final AstValidator validator = new AstValidator(32, 500);
    private final ConstraintCompiler compiler = new ConstraintCompiler(8, 16);
    private final Z3SolverAdapter adapter = new Z3SolverAdapter(5_000);

    private SolverSession session;

    @BeforeEach
    void openSession() {
        session = adapter.openSession();
    }

    @AfterEach
    void closeSession() {
        session.close();
    }

    private ValidatedExpression formula(String source) {
        return validator.validate(parser.parse(source), RootKind.FORMULA);
    }

    private CompiledConstraint compile(String source) {
        return compiler.compile(formula(source), session.variables());
    }

    @Nested
    @DisplayName("SMT-LIB 文本")
    class SmtLibTests {

        @Test
        @DisplayName("变量按名字排序声明，断言在最后")
        void testSmtLib_DeclarationsSorted() {
            String smt = compile("(AND (LT y 10) (GT x 5))").getSmtLib();

            assertAll(
                    () -> assertTrue(smt.contains("(declare-const x Int)"), smt),
                    () -> assertTrue(smt.contains("(declare-const y Int)"), smt),
                    () -> assertTrue(smt.indexOf("declare-const x") < smt.indexOf("declare-const y"), smt),
                    () -> assertTrue(smt.trim().endsWith(")"), smt),
                    () -> assertTrue(smt.lastIndexOf("(assert") > smt.lastIndexOf("declare-const"), smt)
            );
        }

        @Test
        @DisplayName("同一输入在不同会话中得到逐字节相同的文本")
        void testSmtLib_Deterministic() {
            String source = "(AND (GT (PLUS x (MULT 2 y)) 5) (FORALL k (IMPLIES (GT k x) (GT k 0))))";
            String first = compile(source).getSmtLib();
            String second;
            try (SolverSession other = adapter.openSession()) {
                second = compiler.compile(formula(source), other.variables()).getSmtLib();
            }

            assertEquals(first, second);
        }

        @Test
        @DisplayName("数组的长度变量带有非负约束")
        void testSmtLib_ArrayLengthSideCondition() {
            CompiledConstraint constraint = compile("(GT (GET a 0) (LEN a))");

            assertAll(
                    () -> assertEquals(1, constraint.getSideConditions().size()),
                    () -> assertTrue(constraint.getDeclarations().containsKey("a"))
            );
        }
    }

    @Nested
    @DisplayName("编译错误")
    class CompileErrorTests {

        @Test
        @DisplayName("字面量零作除数：DivisionByZero")
        void testCompile_DivisionByZero() {
            assertAll(
                    () -> assertThrows(DivisionByZeroException.class, () -> compile("(GT (DIV x 0) 1)")),
                    () -> assertThrows(DivisionByZeroException.class, () -> compile("(GT (MOD x 0) 1)")),
                    () -> assertThrows(DivisionByZeroException.class, () -> compile("(GT (DIV x 0.0) 1.5)"))
            );
        }

        @Test
        @DisplayName("POW 的指数必须是不超过上限的非负整数字面量")
        void testCompile_PowRules() {
            assertAll(
                    () -> assertThrows(ExponentTooLargeException.class, () -> compile("(GT (POW x 9) 0)")),
                    () -> assertThrows(UnsupportedConstructException.class, () -> compile("(GT (POW x y) 0)")),
                    () -> assertThrows(UnsupportedConstructException.class, () -> compile("(GT (POW x -1) 0)")),
                    () -> assertDoesNotThrow(() -> compile("(GT (POW x 8) 0)"))
            );
        }

        @Test
        @DisplayName("SUM 的个数必须是不超过展开上限的字面量")
        void testCompile_SumRules() {
            assertAll(
                    () -> assertThrows(UnsupportedConstructException.class, () -> compile("(GT (SUM a n) 0)")),
                    () -> assertThrows(UnsupportedConstructException.class, () -> compile("(GT (SUM a 17) 0)")),
                    () -> assertDoesNotThrow(() -> compile("(GT (SUM a 3) 0)"))
            );
        }
    }

    @Nested
    @DisplayName("求解")
    class SolvingTests {

        @Test
        @DisplayName("模型满足原约束")
        void testSolve_SatModel() {
            SolverOutcome outcome = session.check(compile("(AND (GT x 5) (LT y 10))"));

            assertTrue(outcome.isSat());
            long x = Long.parseLong(outcome.getModel().get("x"));
            long y = Long.parseLong(outcome.getModel().get("y"));
            assertAll(
                    () -> assertTrue(x > 5, "x = " + x),
                    () -> assertTrue(y < 10, "y = " + y)
            );
        }

        @Test
        @DisplayName("矛盾约束不可满足")
        void testSolve_Unsat() {
            assertTrue(session.check(compile("(AND (GT x 10) (LT x 5))")).isUnsat());
        }

        @Test
        @DisplayName("整数除法取 SMT-LIB 语义：(DIV 7 2) = 3")
        void testSolve_IntegerDivision() {
            assertAll(
                    () -> assertTrue(session.check(compile("(EQ (DIV 7 2) 3)")).isSat()),
                    () -> assertTrue(session.check(compile("(EQ (DIV 7.0 2) 3.5)")).isSat()),
                    () -> assertTrue(session.check(compile("(EQ (MOD -7 2) 1)")).isSat())
            );
        }

        @Test
        @DisplayName("SET 之后的 GET 读到写入的值，LEN 不变")
        void testSolve_ArrayStore() {
            SolverOutcome outcome = session.check(compile(
                    "(AND (EQ (LEN a) 3) (NE (GET (SET a 1 42) 1) 42))"));

            assertTrue(outcome.isUnsat());
        }

        @Test
        @DisplayName("SUM 展开为前 n 个元素之和")
        void testSolve_Sum() {
            SolverOutcome outcome = session.check(compile(
                    "(AND (EQ (GET a 0) 1) (EQ (GET a 1) 2) (EQ (GET a 2) 3) (NE (SUM a 3) 6))"));

            assertTrue(outcome.isUnsat());
        }

        @Test
        @DisplayName("声称值：整数表达式精确比较，否定式不可满足即成立")
        void testSolve_Claim() {
            ValidatedExpression term = validator.validate(parser.parse("(MULT 2 (PLUS 5 10))"), RootKind.TERM);
            Rational tolerance = Rational.valueOf(1, 1_000_000);

            CompiledConstraint correct = compiler.compileClaim(term, Rational.valueOf(30), tolerance, session.variables());
            CompiledConstraint wrong = compiler.compileClaim(term, Rational.valueOf(31), tolerance, session.variables());
            SolverOutcome counterexample = session.check(wrong.negate(session.variables().getCtx()));

            assertAll(
                    () -> assertTrue(session.check(correct.negate(session.variables().getCtx())).isUnsat()),
                    () -> assertTrue(counterexample.isSat()),
                    () -> assertEquals("30", counterexample.getObserved().get(ConstraintCompiler.OBSERVED_VALUE))
            );
        }
    }
}
