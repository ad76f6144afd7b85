package org.qwed.symbolic;

public enum Satisfiability {
    SAT,
    UNSAT,
    UNKNOWN
}
