package org.qwed.engine.arithmetic;

import org.qwed.core.Artifact;
import org.qwed.core.ArtifactKind;
import org.qwed.core.VerificationConfig;
import org.qwed.engine.ArithmeticDetail;
import org.qwed.engine.EngineResult;
import org.qwed.engine.FailureDetail;
import org.qwed.engine.VerificationEngine;
import org.qwed.errors.CompileException;
import org.qwed.errors.InputException;
import org.qwed.expressions.Expression;
import org.qwed.parser.SExpressionParser;
import org.qwed.utils.Rational;
import org.qwed.validation.AstValidator;
import org.qwed.validation.RootKind;
import org.qwed.validation.ValidatedExpression;
import org.qwed.validation.ValueSort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * 精确算术引擎：不经过求解器，直接用有理数对无变量的表达式求值。
 * 处理 ARITHMETIC 产物，以及不含变量的 LOGIC 产物（此时可满足与有效等价）。
 */
public class ArithmeticEngine implements VerificationEngine {

    private static final Logger logger = LoggerFactory.getLogger(ArithmeticEngine.class);

    public static final String ID = "arithmetic";
    public static final double DEFAULT_WEIGHT = 0.995;

    private static final int DISPLAY_SCALE = 12;

    private final SExpressionParser parser;
    private final AstValidator validator;
    private final ExactEvaluator evaluator;
    private final Rational tolerance;

    public ArithmeticEngine(VerificationConfig config) {
        this.parser = SExpressionParser.fromConfig(config);
        this.validator = AstValidator.fromConfig(config);
        this.evaluator = new ExactEvaluator(config.getMaxExponent());
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

    /**
     * ARITHMETIC 产物总是适用；LOGIC 产物只有在能解析且不含变量时适用，
     * 无法解析的文本留给逻辑引擎报告错误。
     */
    @Override
    public boolean supports(Artifact artifact) {
        if (artifact.getKind() == ArtifactKind.ARITHMETIC) {
            return true;
        }
        if (artifact.getKind() != ArtifactKind.LOGIC) {
            return false;
        }
        try {
            return ExactEvaluator.isGround(parser.parse(artifact.getContent()));
        } catch (InputException e) {
            logger.debug("LOGIC 产物无法解析，不参与精确求值: {}", e.getCode());
            return false;
        }
    }

    @Override
    public EngineResult verify(Artifact artifact) {
        try {
            if (artifact.getKind() == ArtifactKind.ARITHMETIC) {
                return verifyClaim(artifact);
            }
            return verifyGroundFormula(artifact);
        } catch (InputException | CompileException e) {
            logger.info("产物被拒绝 [{}] @{}", e.getCode(), e.getPosition());
            return EngineResult.error(ID, FailureDetail.of(e));
        }
    }

    private EngineResult verifyClaim(Artifact artifact) {
        String claimText = artifact.getClaim()
                .orElseThrow(() -> new IllegalArgumentException("算术产物缺少声称值"));
        Rational claim = parser.parseNumber(claimText);
        ValidatedExpression validated = validator.validate(parser.parse(artifact.getContent()), RootKind.TERM);
        Rational computed = (Rational) evaluator.evaluate(validated);

        boolean matches;
        if (validated.rootSort() == ValueSort.INT && claim.isInteger()) {
            matches = computed.equals(claim);
        } else {
            matches = computed.subtract(claim).abs().compareTo(tolerance) <= 0;
        }
        ArithmeticDetail detail = new ArithmeticDetail(computed.toDecimalString(DISPLAY_SCALE), claimText.trim());
        logger.debug("算术核对: {}", detail.summary());
        return matches ? EngineResult.verified(ID, 1.0, detail) : EngineResult.failed(ID, 1.0, detail);
    }

    private EngineResult verifyGroundFormula(Artifact artifact) {
        Expression ast = parser.parse(artifact.getContent());
        ValidatedExpression validated = validator.validate(ast, RootKind.FORMULA);
        boolean value = (Boolean) evaluator.evaluate(validated);
        ArithmeticDetail detail = new ArithmeticDetail(Boolean.toString(value), "true");
        return value ? EngineResult.verified(ID, 1.0, detail) : EngineResult.failed(ID, 1.0, detail);
    }
}
