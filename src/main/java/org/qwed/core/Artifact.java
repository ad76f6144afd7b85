package org.qwed.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * 待验证的产物。此类是不可变的，可以在并发的引擎调用之间共享。
 */
@Getter
@EqualsAndHashCode
public final class Artifact {

    private final ArtifactKind kind;
    private final String content;
    private final String claim;
    private final LogicGoal goal;

    private Artifact(ArtifactKind kind, String content, String claim, LogicGoal goal) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.content = Objects.requireNonNull(content, "content cannot be null");
        this.claim = claim;
        this.goal = Objects.requireNonNull(goal, "goal cannot be null");
    }

    /**
     * 工厂方法：可满足性目标的逻辑约束。
     */
    public static Artifact logic(String constraint) {
        return new Artifact(ArtifactKind.LOGIC, constraint, null, LogicGoal.SATISFIABLE);
    }

    /**
     * 工厂方法：指定目标的逻辑约束。
     */
    public static Artifact logic(String constraint, LogicGoal goal) {
        return new Artifact(ArtifactKind.LOGIC, constraint, null, goal);
    }

    /**
     * 工厂方法：算术表达式及其声称值，例如 ("(MULT 2 (PLUS 5 10))", "30")。
     */
    public static Artifact arithmetic(String expression, String claimedValue) {
        Objects.requireNonNull(claimedValue, "claimedValue cannot be null");
        return new Artifact(ArtifactKind.ARITHMETIC, expression, claimedValue, LogicGoal.SATISFIABLE);
    }

    public static Artifact sql(String query) {
        return new Artifact(ArtifactKind.SQL, query, null, LogicGoal.SATISFIABLE);
    }

    public static Artifact code(String source) {
        return new Artifact(ArtifactKind.CODE, source, null, LogicGoal.SATISFIABLE);
    }

    public Optional<String> getClaim() {
        return Optional.ofNullable(claim);
    }

    public int contentBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public String toString() {
        // 不输出正文，避免把不可信文本写进日志
        return "Artifact(" + kind + ", " + goal + ", " + content.length() + " chars)";
    }
}
