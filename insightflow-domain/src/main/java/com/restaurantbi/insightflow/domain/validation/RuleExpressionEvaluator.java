package com.restaurantbi.insightflow.domain.validation;

import com.restaurantbi.insightflow.domain.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * RuleExpressionEvaluator - EXPRESSION 规则的 SpEL 求值器
 * <p>
 * 记录以变量 #record 暴露，表达式按字符串缓存。
 * </p>
 */
@Slf4j
public class RuleExpressionEvaluator {

    private static final ExpressionParser PARSER = new SpelExpressionParser();

    private final Map<String, Expression> cache = new ConcurrentHashMap<>();

    /**
     * 加载期语法检查
     *
     * @throws ConfigurationException 表达式为空或无法解析
     */
    public static void checkSyntax(String ruleName, String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Expression rule [" + ruleName + "] has no expression");
        }
        try {
            PARSER.parseExpression(expression);
        } catch (ParseException e) {
            throw new ConfigurationException("Expression rule [" + ruleName + "] cannot be parsed: " + expression, e);
        }
    }

    /**
     * 对单条记录求值；求值异常视为不满足
     */
    public boolean test(String expressionStr, Map<String, Object> record) {
        Expression expression = cache.computeIfAbsent(expressionStr, PARSER::parseExpression);
        EvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding().build();
        context.setVariable("record", record);
        try {
            Boolean result = expression.getValue(context, Boolean.class);
            return result != null && result;
        } catch (EvaluationException e) {
            log.debug("Rule expression evaluation failed: [{}]", expressionStr, e);
            return false;
        }
    }
}
