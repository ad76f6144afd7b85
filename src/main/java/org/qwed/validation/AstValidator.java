package org.qwed.validation;

import org.qwed.core.VerificationConfig;
import org.qwed.errors.ValidationException;
import org.qwed.errors.ValidationFailure;
import org.qwed.expressions.Compound;
import org.qwed.expressions.Expression;
import org.qwed.expressions.OperatorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 安全边界：编译器只会看到通过此处白名单检查的语法树。
 * 依次检查运算符、元数、深度与节点数，最后做类别推断。校验是全有或全无的。
 */
public class AstValidator {

    private static final Logger logger = LoggerFactory.getLogger(AstValidator.class);

    private final int maxDepth;
    private final int maxNodes;

    public AstValidator(int maxDepth, int maxNodes) {
        if (maxDepth <= 0 || maxNodes <= 0) {
            throw new IllegalArgumentException("maxDepth 与 maxNodes 必须为正数");
        }
        this.maxDepth = maxDepth;
        this.maxNodes = maxNodes;
    }

    public static AstValidator fromConfig(VerificationConfig config) {
        return new AstValidator(config.getMaxDepth(), config.getMaxNodes());
    }

    /**
     * @param root 解析器产出的语法树。
     * @param rootKind 对根节点的期望。
     * @return 带类别信息的已校验表达式。
     * @throws ValidationException 任何一项检查不通过。
     */
    public ValidatedExpression validate(Expression root, RootKind rootKind) {
        int[] visited = {0};
        checkStructure(root, 1, visited);
        TypeEnvironment types = new SortInference().infer(root, rootKind);
        logger.debug("校验通过: {} 个节点", visited[0]);
        return new ValidatedExpression(root, types, rootKind);
    }

    private void checkStructure(Expression node, int level, int[] visited) {
        visited[0]++;
        if (visited[0] > maxNodes) {
            throw reject(ValidationFailure.NODE_COUNT_EXCEEDED, node, "节点数超过上限 " + maxNodes);
        }
        if (level > maxDepth) {
            throw reject(ValidationFailure.DEPTH_EXCEEDED, node, "深度超过上限 " + maxDepth);
        }
        if (!(node instanceof Compound compound)) {
            return;
        }
        OperatorKind operator = compound.getOperator();
        if (!operator.getArity().accepts(compound.arity())) {
            throw reject(ValidationFailure.ARITY_MISMATCH, node,
                    operator + " 需要 " + operator.getArity() + " 个操作数，实际为 " + compound.arity());
        }
        for (Expression operand : compound.getOperands()) {
            checkStructure(operand, level + 1, visited);
        }
    }

    private static ValidationException reject(ValidationFailure failure, Expression node, String message) {
        logger.warn("校验失败 [{}] @{}", failure, node.getPosition());
        return new ValidationException(failure, node.getPosition(), message);
    }
}
