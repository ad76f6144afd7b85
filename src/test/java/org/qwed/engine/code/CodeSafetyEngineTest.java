package org.qwed.engine.code;

import org.qwed.core.Artifact;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.EngineResult;
import org.qwed.engine.EngineStatus;
import org.qwed.engine.Finding;
import org.qwed.engine.FindingsDetail;
import org.qwed.engine.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CodeSafetyEngineTest {

    private final CodeSafetyEngine engine = new CodeSafetyEngine(VerificationConfig.defaults());

    @Nested
    @DisplayName("CRITICAL：阻断")
    class CriticalTests {

        @Test
        @DisplayName("eval 调用：BLOCKED")
        void testVerify_Eval() {
            EngineResult result = engine.verify(Artifact.code("x = eval(user_input)"));

            FindingsDetail detail = assertInstanceOf(FindingsDetail.class, result.getDetail());
            assertAll(
                    () -> assertEquals(EngineStatus.BLOCKED, result.getStatus()),
                    () -> assertEquals(1L, detail.count(Severity.CRITICAL)),
                    () -> assertEquals("eval", detail.getFindings().get(0).getSubject())
            );
        }

        @Test
        @DisplayName("危险属性与反序列化")
        void testScan_AttributesAndPickle() {
            List<Finding> findings = engine.scan("obj.__class__.__subclasses__()\ndata = pickle.loads(blob)");

            assertAll(
                    () -> assertTrue(findings.stream().anyMatch(f -> f.getSubject().equals("__class__"))),
                    () -> assertTrue(findings.stream().anyMatch(f -> f.getSubject().equals("__subclasses__"))),
                    () -> assertTrue(findings.stream().anyMatch(f -> f.getSubject().equals("pickle.loads")))
            );
        }

        @Test
        @DisplayName("口令场景下的弱哈希")
        void testScan_WeakHashWithPassword() {
            List<Finding> withPassword = engine.scan("digest = hashlib.md5(password.encode()).hexdigest()");
            List<Finding> withoutPassword = engine.scan("digest = hashlib.md5(data).hexdigest()");

            assertAll(
                    () -> assertTrue(withPassword.stream().anyMatch(f -> f.isCritical()
                            && f.getType().equals("weak_crypto_with_password"))),
                    () -> assertTrue(withoutPassword.isEmpty())
            );
        }
    }

    @Nested
    @DisplayName("WARNING：通过但需复核")
    class WarningTests {

        @Test
        @DisplayName("子进程与危险模块导入：VERIFIED，置信度降低")
        void testVerify_Subprocess() {
            EngineResult result = engine.verify(Artifact.code("import subprocess\nsubprocess.run(['ls'])"));

            FindingsDetail detail = assertInstanceOf(FindingsDetail.class, result.getDetail());
            assertAll(
                    () -> assertEquals(EngineStatus.VERIFIED, result.getStatus()),
                    () -> assertEquals(CodeSafetyEngine.REVIEW_CONFIDENCE, result.getConfidence()),
                    () -> assertEquals(0L, detail.count(Severity.CRITICAL)),
                    () -> assertEquals(2L, detail.count(Severity.WARNING))
            );
        }
    }

    @Test
    @DisplayName("相似的名字不会误报")
    void testScan_NoFalsePositives() {
        assertAll(
                () -> assertTrue(engine.scan("result = evaluate(model)").isEmpty()),
                () -> assertTrue(engine.scan("f = dialog.open(path)").isEmpty()),
                () -> assertTrue(engine.scan("import osmnx").isEmpty())
        );
    }

    @Test
    @DisplayName("安全代码：VERIFIED，置信度 1")
    void testVerify_Safe() {
        EngineResult result = engine.verify(Artifact.code("def add(a, b):\n    return a + b\n"));

        assertAll(
                () -> assertEquals(EngineStatus.VERIFIED, result.getStatus()),
                () -> assertEquals(1.0, result.getConfidence())
        );
    }
}
