package org.qwed.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Z3Exception;
import org.qwed.errors.SolverInternalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 基于 Z3 的求解器适配器。Z3 Context 不是线程安全的，因此每个会话新建一个 Context。
 */
public class Z3SolverAdapter implements SolverAdapter {

    private static final Logger logger = LoggerFactory.getLogger(Z3SolverAdapter.class);

    private final long timeoutMillis;

    public Z3SolverAdapter(long timeoutMillis) {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive: " + timeoutMillis);
        }
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public SolverSession openSession() {
        Context ctx;
        try {
            ctx = new Context();
        } catch (Z3Exception | UnsatisfiedLinkError e) {
            logger.error("无法创建 Z3 Context: {}", e.getMessage());
            throw new SolverInternalException("无法创建 Z3 Context: " + e.getMessage(), e);
        }
        logger.debug("打开 Z3 会话，超时 {}ms", timeoutMillis);
        return new Z3Oracle(ctx, timeoutMillis);
    }
}
