package org.qwed.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * 安全扫描发现的一个问题。
 */
@Getter
@EqualsAndHashCode
public final class Finding implements Comparable<Finding> {

    private final Severity severity;
    private final String type;
    private final String subject;
    private final String description;

    public Finding(Severity severity, String type, String subject, String description) {
        this.severity = Objects.requireNonNull(severity, "severity cannot be null");
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.subject = Objects.requireNonNull(subject, "subject cannot be null");
        this.description = Objects.requireNonNull(description, "description cannot be null");
    }

    public boolean isCritical() {
        return severity == Severity.CRITICAL;
    }

    /**
     * CRITICAL 在前，其次按类型和对象排序，保证输出顺序与扫描顺序无关。
     */
    @Override
    public int compareTo(Finding other) {
        int bySeverity = severity.compareTo(other.severity);
        if (bySeverity != 0) {
            return bySeverity;
        }
        int byType = type.compareTo(other.type);
        return byType != 0 ? byType : subject.compareTo(other.subject);
    }

    @Override
    public String toString() {
        return severity + ":" + type + "(" + subject + ")";
    }
}
