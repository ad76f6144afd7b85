package org.qwed.engine.sql;

import org.qwed.core.Artifact;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.EngineResult;
import org.qwed.engine.EngineStatus;
import org.qwed.engine.Finding;
import org.qwed.engine.FindingsDetail;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SqlSafetyEngineTest {

    private final SqlSafetyEngine engine = new SqlSafetyEngine(VerificationConfig.defaults());

    private Set<String> findingTypes(String sql) {
        return engine.scan(sql).stream().map(Finding::getType).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("放行的查询")
    class AllowedTests {

        @Test
        @DisplayName("普通只读查询：VERIFIED，没有发现")
        void testVerify_PlainSelect() {
            EngineResult result = engine.verify(Artifact.sql(
                    "SELECT id, name FROM users WHERE age > 18 ORDER BY name LIMIT 10"));

            FindingsDetail detail = assertInstanceOf(FindingsDetail.class, result.getDetail());
            assertAll(
                    () -> assertEquals(EngineStatus.VERIFIED, result.getStatus()),
                    () -> assertEquals(1.0, result.getConfidence()),
                    () -> assertTrue(detail.getFindings().isEmpty())
            );
        }

        @Test
        @DisplayName("字符串和函数名中的关键字不算写操作")
        void testScan_KeywordsInsideLiterals() {
            assertAll(
                    () -> assertTrue(engine.scan("SELECT * FROM logs WHERE message = 'DROP TABLE users'").isEmpty()),
                    () -> assertTrue(engine.scan("SELECT REPLACE(name, 'a', 'b') FROM items").isEmpty()),
                    () -> assertTrue(engine.scan("SELECT * FROM t WHERE a.id = b.id").isEmpty()),
                    () -> assertTrue(engine.scan("SELECT 1;").isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("阻断的查询")
    class BlockedTests {

        @Test
        @DisplayName("破坏性语句：BLOCKED")
        void testVerify_Destructive() {
            EngineResult result = engine.verify(Artifact.sql("DROP TABLE users"));

            assertAll(
                    () -> assertEquals(EngineStatus.BLOCKED, result.getStatus()),
                    () -> assertEquals(1.0, result.getConfidence()),
                    () -> assertEquals(Set.of("destructive_command"), findingTypes("DROP TABLE users"))
            );
        }

        @Test
        @DisplayName("多语句堆叠")
        void testScan_Stacked() {
            assertEquals(Set.of("stacked_statements", "destructive_command"),
                    findingTypes("SELECT * FROM users; DELETE FROM users"));
        }

        @Test
        @DisplayName("注释注入")
        void testScan_Comments() {
            assertAll(
                    () -> assertTrue(findingTypes("SELECT * FROM users WHERE name = 'a' -- AND pw = 'x'")
                            .contains("comment_injection")),
                    () -> assertTrue(findingTypes("SELECT * /* x */ FROM users").contains("comment_injection"))
            );
        }

        @Test
        @DisplayName("恒真条件")
        void testScan_Tautology() {
            assertAll(
                    () -> assertTrue(findingTypes("SELECT * FROM users WHERE name = '' OR 1=1").contains("tautology")),
                    () -> assertTrue(findingTypes("SELECT * FROM users WHERE id = 5 OR 'a'='a'").contains("tautology")),
                    () -> assertTrue(findingTypes("SELECT * FROM users WHERE active OR TRUE").contains("tautology"))
            );
        }

        @Test
        @DisplayName("敏感列与管理类语句")
        void testScan_SensitiveAndAdmin() {
            assertAll(
                    () -> assertEquals(Set.of("sensitive_column"), findingTypes("SELECT password FROM users")),
                    () -> assertEquals(Set.of("admin_command"), findingTypes("GRANT ALL ON users TO bob"))
            );
        }

        @Test
        @DisplayName("子查询中的写操作")
        void testScan_NestedWrite() {
            assertTrue(findingTypes("SELECT * FROM (DELETE FROM users RETURNING *) t").contains("destructive_command"));
        }

        @Test
        @DisplayName("未闭合的字符串：syntax_error")
        void testScan_Unterminated() {
            assertEquals(Set.of("syntax_error"), findingTypes("SELECT * FROM users WHERE name = 'abc"));
        }

        @Test
        @DisplayName("额外配置的阻断列")
        void testScan_ExtraBlockedColumns() {
            SqlSafetyEngine strict = new SqlSafetyEngine(VerificationConfig.defaults(), Set.of("Email"));

            List<Finding> findings = strict.scan("SELECT email FROM users");
            assertAll(
                    () -> assertEquals(1, findings.size()),
                    () -> assertEquals("email", findings.get(0).getSubject())
            );
        }
    }
}
