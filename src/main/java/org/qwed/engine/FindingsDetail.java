package org.qwed.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

@Getter
@EqualsAndHashCode
public final class FindingsDetail implements EngineDetail {

    private final List<Finding> findings;

    public FindingsDetail(Collection<Finding> findings) {
        // 去重并排序
        this.findings = Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(findings)));
    }

    public boolean hasCritical() {
        return findings.stream().anyMatch(Finding::isCritical);
    }

    public long count(Severity severity) {
        return findings.stream().filter(f -> f.getSeverity() == severity).count();
    }

    @Override
    public String summary() {
        return count(Severity.CRITICAL) + " critical, " + count(Severity.WARNING) + " warning";
    }

    @Override
    public String toString() {
        return "Findings" + findings;
    }
}
