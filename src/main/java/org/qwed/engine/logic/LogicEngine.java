package org.qwed.engine.logic;

import org.qwed.compiler.CompiledConstraint;
import org.qwed.compiler.ConstraintCompiler;
import org.qwed.core.Artifact;
import org.qwed.core.ArtifactKind;
import org.qwed.core.LogicGoal;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.EngineResult;
import org.qwed.engine.FailureDetail;
import org.qwed.engine.VerificationEngine;
import org.qwed.errors.CompileException;
import org.qwed.errors.InputException;
import org.qwed.expressions.Expression;
import org.qwed.parser.SExpressionParser;
import org.qwed.symbolic.SolverAdapter;
import org.qwed.symbolic.SolverOutcome;
import org.qwed.symbolic.SolverSession;
import org.qwed.utils.Rational;
import org.qwed.validation.AstValidator;
import org.qwed.validation.RootKind;
import org.qwed.validation.ValidatedExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 逻辑引擎：解析 → 校验 → 编译 → 求解 → 格式化。
 * 处理 LOGIC 产物（可满足性或有效性）和 ARITHMETIC 产物（声称值对所有赋值成立）。
 * 每次调用独占一个求解会话，引擎实例本身无状态，可以并发调用。
 */
public class LogicEngine implements VerificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(LogicEngine.class);

    public static final String ID = "logic";
    public static final double DEFAULT_WEIGHT = 1.0;

    private final SExpressionParser parser;
    private final AstValidator validator;
    private final ConstraintCompiler compiler;
    private final SolverAdapter solverAdapter;
    private final Rational tolerance;
    private final ResultFormatter formatter = new ResultFormatter(ID);

    public LogicEngine(VerificationConfig config, SolverAdapter solverAdapter) {
        this(config, solverAdapter, ConstraintCompiler.fromConfig(config));
    }

    public LogicEngine(VerificationConfig config, SolverAdapter solverAdapter, ConstraintCompiler compiler) {
        this.parser = SExpressionParser.fromConfig(config);
        this.validator = AstValidator.fromConfig(config);
        this.compiler = Objects.requireNonNull(compiler, "compiler cannot be null");
        this.solverAdapter = Objects.requireNonNull(solverAdapter, "solverAdapter cannot be null");
        this.tolerance = Rational.valueOf(BigDecimal.valueOf(config.getArithmeticTolerance()));
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
        return artifact.getKind() == ArtifactKind.LOGIC || artifact.getKind() == ArtifactKind.ARITHMETIC;
    }

    @Override
    public EngineResult verify(Artifact artifact) {
        try {
            if (artifact.getKind() == ArtifactKind.ARITHMETIC) {
                return verifyClaim(artifact);
            }
            if (artifact.getKind() == ArtifactKind.LOGIC) {
                return verifyConstraint(artifact);
            }
            throw new IllegalArgumentException("逻辑引擎不支持 " + artifact.getKind());
        } catch (InputException | CompileException e) {
            logger.info("产物被拒绝 [{}] @{}", e.getCode(), e.getPosition());
            return EngineResult.error(ID, FailureDetail.of(e));
        }
    }

    private EngineResult verifyConstraint(Artifact artifact) {
        Expression ast = parser.parse(artifact.getContent());
        ValidatedExpression validated = validator.validate(ast, RootKind.FORMULA);
        try (SolverSession session = solverAdapter.openSession()) {
            CompiledConstraint constraint = compiler.compile(validated, session.variables());
            // 有效性：否定式不可满足即原式恒真
            CompiledConstraint query = artifact.getGoal() == LogicGoal.VALID
                    ? constraint.negate(session.variables().getCtx())
                    : constraint;
            SolverOutcome outcome = session.check(query);
            EngineResult result = formatter.format(artifact.getGoal(), outcome, query.getSmtLib());
            logger.debug("逻辑约束判定: {}", result.getStatus());
            return result;
        }
    }

    private EngineResult verifyClaim(Artifact artifact) {
        String claimText = artifact.getClaim()
                .orElseThrow(() -> new IllegalArgumentException("算术产物缺少声称值"));
        // 声称值单独按数字文法解析，绝不拼接进表达式文本
        Rational claim = parser.parseNumber(claimText);
        Expression ast = parser.parse(artifact.getContent());
        ValidatedExpression validated = validator.validate(ast, RootKind.TERM);
        try (SolverSession session = solverAdapter.openSession()) {
            CompiledConstraint constraint = compiler.compileClaim(validated, claim, tolerance, session.variables());
            CompiledConstraint query = constraint.negate(session.variables().getCtx());
            SolverOutcome outcome = session.check(query);
            EngineResult result = formatter.format(LogicGoal.VALID, outcome, query.getSmtLib());
            logger.debug("算术声称判定: {}", result.getStatus());
            return result;
        }
    }
}
