package org.qwed.engine.sql;

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
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * SQL 防火墙：只放行只读查询。
 * 破坏性语句、管理类语句、多语句堆叠、注释注入、敏感列访问和恒真条件都会被阻断。
 */
public class SqlSafetyEngine implements VerificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(SqlSafetyEngine.class);

    public static final String ID = "sql";
    public static final double DEFAULT_WEIGHT = 0.99;

    static final Set<String> DESTRUCTIVE_COMMANDS = Set.of(
            "DROP", "DELETE", "UPDATE", "INSERT", "ALTER", "TRUNCATE", "CREATE", "MERGE");

    static final Set<String> ADMIN_COMMANDS = Set.of(
            "GRANT", "REVOKE", "SET", "BEGIN", "COMMIT", "ROLLBACK", "START", "SAVEPOINT",
            "EXEC", "EXECUTE", "CALL", "LOCK", "UNLOCK", "COPY", "LOAD", "VACUUM");

    static final Set<String> SENSITIVE_COLUMNS = Set.of(
            "password", "password_hash", "passwd", "pwd",
            "secret", "secret_key", "api_key", "token",
            "ssn", "social_security", "salary", "credit_card",
            "bank_account", "balance");

    private final int maxInputBytes;
    private final Set<String> blockedColumns;

    public SqlSafetyEngine(VerificationConfig config) {
        this(config, Set.of());
    }

    /**
     * @param extraBlockedColumns 除默认敏感列之外需要额外阻断的列名（大小写不敏感）。
     */
    public SqlSafetyEngine(VerificationConfig config, Set<String> extraBlockedColumns) {
        this.maxInputBytes = config.getMaxInputBytes();
        Set<String> columns = new HashSet<>(SENSITIVE_COLUMNS);
        for (String column : extraBlockedColumns) {
            columns.add(column.toLowerCase(Locale.ROOT));
        }
        this.blockedColumns = Set.copyOf(columns);
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
        return artifact.getKind() == ArtifactKind.SQL;
    }

    @Override
    public EngineResult verify(Artifact artifact) {
        FindingsDetail detail = new FindingsDetail(scan(artifact.getContent()));
        if (detail.hasCritical()) {
            logger.info("SQL 被阻断: {}", detail.summary());
            return EngineResult.blocked(ID, detail);
        }
        return EngineResult.verified(ID, 1.0, detail);
    }

    List<Finding> scan(String sql) {
        List<Finding> findings = new ArrayList<>();
        int bytes = sql.getBytes(StandardCharsets.UTF_8).length;
        if (bytes > maxInputBytes) {
            findings.add(critical("input_too_large", String.valueOf(bytes), "SQL 长度超过上限 " + maxInputBytes + " 字节"));
            return findings;
        }
        List<SqlToken> tokens;
        try {
            tokens = SqlTokenizer.tokenize(sql);
        } catch (SqlTokenizer.UnterminatedException e) {
            findings.add(critical("syntax_error", "offset " + e.getOffset(), e.getMessage()));
            return findings;
        }

        List<SqlToken> code = new ArrayList<>();
        for (SqlToken token : tokens) {
            if (token.getKind() == SqlToken.Kind.COMMENT) {
                findings.add(critical("comment_injection", "offset " + token.getOffset(), "查询中包含注释，可能用于截断条件"));
            } else {
                code.add(token);
            }
        }
        if (code.isEmpty()) {
            findings.add(critical("syntax_error", "empty", "没有可执行的语句"));
            return findings;
        }
        checkStatements(code, findings);
        checkColumns(code, findings);
        checkTautologies(code, findings);
        return findings;
    }

    /**
     * 语句类型只看语句开头以及括号前后的第一个关键字，避免把 FOR UPDATE、REPLACE() 之类误判为写操作。
     */
    private void checkStatements(List<SqlToken> code, List<Finding> findings) {
        for (int i = 0; i < code.size(); i++) {
            SqlToken token = code.get(i);
            if (token.is(SqlToken.Kind.PUNCTUATION, ";") && i + 1 < code.size()) {
                findings.add(critical("stacked_statements", "offset " + token.getOffset(), "一次只允许执行一条语句"));
            }
            if (token.getKind() != SqlToken.Kind.WORD || !startsStatement(code, i)) {
                continue;
            }
            String keyword = token.normalized();
            if (DESTRUCTIVE_COMMANDS.contains(keyword)) {
                findings.add(critical("destructive_command", keyword, "检测到破坏性语句 " + keyword + "，只允许 SELECT"));
            } else if (ADMIN_COMMANDS.contains(keyword)) {
                findings.add(critical("admin_command", keyword, "检测到管理类语句 " + keyword));
            }
        }
    }

    private static boolean startsStatement(List<SqlToken> code, int index) {
        if (index == 0) {
            return true;
        }
        SqlToken previous = code.get(index - 1);
        return previous.is(SqlToken.Kind.PUNCTUATION, ";")
                || previous.is(SqlToken.Kind.PUNCTUATION, "(")
                || previous.is(SqlToken.Kind.PUNCTUATION, ")");
    }

    private void checkColumns(List<SqlToken> code, List<Finding> findings) {
        for (SqlToken token : code) {
            if (token.getKind() != SqlToken.Kind.WORD && token.getKind() != SqlToken.Kind.QUOTED_IDENTIFIER) {
                continue;
            }
            String name = token.getText().toLowerCase(Locale.ROOT);
            if (blockedColumns.contains(name)) {
                findings.add(critical("sensitive_column", name, "禁止访问敏感列 '" + name + "'"));
            }
        }
    }

    private void checkTautologies(List<SqlToken> code, List<Finding> findings) {
        for (int i = 1; i + 1 < code.size(); i++) {
            SqlToken token = code.get(i);
            if (token.is(SqlToken.Kind.WORD, "OR") && code.get(i + 1).is(SqlToken.Kind.WORD, "TRUE")) {
                findings.add(critical("tautology", "OR TRUE", "检测到 'OR TRUE' 恒真条件"));
                continue;
            }
            if (token.getKind() != SqlToken.Kind.OPERATOR
                    || !(token.getText().equals("=") || token.getText().equals("=="))) {
                continue;
            }
            SqlToken left = code.get(i - 1);
            SqlToken right = code.get(i + 1);
            if (left.getKind() != right.getKind() || !left.normalized().equals(right.normalized())) {
                continue;
            }
            boolean simpleOperands = left.isLiteral()
                    || left.getKind() == SqlToken.Kind.WORD
                    || left.getKind() == SqlToken.Kind.QUOTED_IDENTIFIER;
            if (simpleOperands && isStandalone(code, i - 2) && isStandalone(code, i + 2)) {
                String text = render(left) + "=" + render(right);
                findings.add(critical("tautology", text, "检测到恒真条件 " + text + "，疑似注入"));
            }
        }
    }

    /**
     * 相邻位置不是 '.' 或算术运算符时，比较的两侧才是完整的操作数。
     */
    private static boolean isStandalone(List<SqlToken> code, int neighbour) {
        if (neighbour < 0 || neighbour >= code.size()) {
            return true;
        }
        SqlToken token = code.get(neighbour);
        return !token.is(SqlToken.Kind.PUNCTUATION, ".") && token.getKind() != SqlToken.Kind.OPERATOR;
    }

    private static String render(SqlToken token) {
        return token.getKind() == SqlToken.Kind.STRING ? "'" + token.getText() + "'" : token.getText();
    }

    private static Finding critical(String type, String subject, String description) {
        return new Finding(Severity.CRITICAL, type, subject, description);
    }
}
