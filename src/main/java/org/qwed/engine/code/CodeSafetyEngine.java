package org.qwed.engine.code;

import org.qwed.core.Artifact;
import org.qwed.core.ArtifactKind;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.EngineResult;
import org.qwed.engine.Finding;
import org.qwed.engine.FindingsDetail;
import org.qwed.engine.Severity;
import org.qwed.engine.VerificationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Python 代码片段的静态安全扫描。
 * CRITICAL（动态执行、反序列化、危险双下划线属性、口令场景下的弱哈希）直接阻断；
 * 只有 WARNING（系统命令、子进程、网络、危险模块导入）时通过但降低置信度，提示人工复核。
 */
public class CodeSafetyEngine implements VerificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(CodeSafetyEngine.class);

    public static final String ID = "code";
    public static final double DEFAULT_WEIGHT = 0.99;

    /** 只有警告时的置信度。 */
    static final double REVIEW_CONFIDENCE = 0.7;

    static final Set<String> CRITICAL_FUNCTIONS = Set.of(
            "eval", "exec", "compile", "__import__",
            "pickle.loads", "pickle.load", "yaml.unsafe_load", "getattr");

    static final Set<String> WEAK_HASH_FUNCTIONS = Set.of("hashlib.md5", "hashlib.sha1");

    static final Set<String> PASSWORD_INDICATORS = Set.of(
            "password", "passwd", "pwd", "pass", "credential", "cred", "auth", "secret", "token", "key");

    static final Set<String> WARNING_FUNCTIONS = Set.of(
            "open",
            "os.system", "os.popen", "os.spawn", "os.spawnl", "os.spawnv",
            "os.remove", "os.unlink", "os.rmdir", "os.removedirs",
            "os.rename", "os.chmod", "os.chown", "os.kill", "os.fork",
            "subprocess.call", "subprocess.Popen", "subprocess.run", "subprocess.check_output",
            "shutil.rmtree", "shutil.move", "shutil.copy", "shutil.copyfile",
            "socket.socket", "socket.create_connection",
            "urllib.request.urlopen", "urllib.request.urlretrieve",
            "requests.get", "requests.post",
            "http.client.HTTPConnection", "http.client.HTTPSConnection");

    static final Set<String> DANGEROUS_MODULES = Set.of(
            "telnetlib", "ftplib", "os", "subprocess", "shutil", "socket", "urllib",
            "http.client", "requests", "pickle", "marshal", "importlib", "imp");

    static final Set<String> DANGEROUS_ATTRIBUTES = Set.of(
            "__class__", "__base__", "__subclasses__", "__globals__",
            "__builtins__", "__code__", "__dict__");

    private static final Map<String, Pattern> CRITICAL_CALLS = callPatterns(CRITICAL_FUNCTIONS);
    private static final Map<String, Pattern> WEAK_HASH_CALLS = callPatterns(WEAK_HASH_FUNCTIONS);
    private static final Map<String, Pattern> WARNING_CALLS = callPatterns(WARNING_FUNCTIONS);
    private static final Map<String, Pattern> MODULE_IMPORTS = importPatterns(DANGEROUS_MODULES);

    private final int maxInputBytes;

    public CodeSafetyEngine(VerificationConfig config) {
        this.maxInputBytes = config.getMaxInputBytes();
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public double getDefaultWeight() {
        return DEFAULT_WEIGHT;
    }

    @Override
    public boolean supports(Artifact artifact) {
        return artifact.getKind() == ArtifactKind.CODE;
    }

    @Override
    public EngineResult verify(Artifact artifact) {
        FindingsDetail detail = new FindingsDetail(scan(artifact.getContent()));
        if (detail.hasCritical()) {
            logger.info("代码被阻断: {}", detail.summary());
            return EngineResult.blocked(ID, detail);
        }
        if (!detail.getFindings().isEmpty()) {
            logger.debug("代码需要人工复核: {}", detail.summary());
            return EngineResult.verified(ID, REVIEW_CONFIDENCE, detail);
        }
        return EngineResult.verified(ID, 1.0, detail);
    }

    List<Finding> scan(String source) {
        List<Finding> findings = new ArrayList<>();
        int bytes = source.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > maxInputBytes) {
            findings.add(new Finding(Severity.CRITICAL, "input_too_large", String.valueOf(bytes),
                    "代码长度超过上限 " + maxInputBytes + " 字节"));
            return findings;
        }
        CRITICAL_CALLS.forEach((name, pattern) -> {
            if (pattern.matcher(source).find()) {
                findings.add(new Finding(Severity.CRITICAL, "dangerous_function", name,
                        "检测到高危函数 '" + name + "'"));
            }
        });
        for (String attribute : DANGEROUS_ATTRIBUTES) {
            if (source.contains(attribute)) {
                findings.add(new Finding(Severity.CRITICAL, "dangerous_attribute", attribute,
                        "检测到危险属性 '" + attribute + "'"));
            }
        }
        WARNING_CALLS.forEach((name, pattern) -> {
            if (pattern.matcher(source).find()) {
                findings.add(new Finding(Severity.WARNING, "context_dependent_function", name,
                        "函数 '" + name + "' 需要人工复核"));
            }
        });
        MODULE_IMPORTS.forEach((module, pattern) -> {
            if (pattern.matcher(source).find()) {
                findings.add(new Finding(Severity.WARNING, "dangerous_import", module,
                        "导入模块 '" + module + "' 需要人工复核"));
            }
        });
        if (hasPasswordContext(source)) {
            WEAK_HASH_CALLS.forEach((name, pattern) -> {
                if (pattern.matcher(source).find()) {
                    findings.add(new Finding(Severity.CRITICAL, "weak_crypto_with_password", name,
                            "口令场景下使用弱哈希 '" + name + "'，应使用 bcrypt/argon2"));
                }
            });
        }
        return findings;
    }

    private static boolean hasPasswordContext(String source) {
        String lower = source.toLowerCase(Locale.ROOT);
        return PASSWORD_INDICATORS.stream().anyMatch(lower::contains);
    }

    /**
     * 函数名前不能紧跟标识符字符或 '.'，后面跟 '('，避免 evaluate( 或 obj.open( 之类误报。
     */
    private static Map<String, Pattern> callPatterns(Set<String> names) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        names.stream().sorted().forEach(name ->
                patterns.put(name, Pattern.compile("(?<![\\w.])" + Pattern.quote(name) + "\\s*\\(")));
        return patterns;
    }

    private static Map<String, Pattern> importPatterns(Set<String> modules) {
        Map<String, Pattern> patterns = new LinkedHashMap<>();
        modules.stream().sorted().forEach(module ->
                patterns.put(module, Pattern.compile(
                        "(?m)^\\s*(?:import|from)\\s+" + Pattern.quote(module) + "(?![\\w])")));
        return patterns;
    }
}
