package id.go.kemenkeu.djpbn.sakti.wf.starter.util;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

/**
 * Evaluates lock-key expressions against the intercepted method's arguments.
 * Arguments are visible as {@code #name}, {@code #a0..#aN} and {@code #args}.
 */
public final class SpelExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(SpelExpressionEvaluator.class);

    private static final ExpressionParser PARSER = new SpelExpressionParser();

    private SpelExpressionEvaluator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String evaluate(String expression, ProceedingJoinPoint pjp, String fallback) {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        return evaluate(expression, signature.getParameterNames(), pjp.getArgs(), fallback);
    }

    /**
     * An expression that does not parse is used as a literal key.
     */
    public static String evaluate(String expression, String[] paramNames, Object[] args, String fallback) {
        if (expression == null || expression.trim().isEmpty()) {
            return fallback;
        }
        try {
            Object value = PARSER.parseExpression(expression).getValue(createContext(paramNames, args));
            return value != null ? value.toString() : fallback;
        } catch (ExpressionException e) {
            log.warn("Lock key expression '{}' not evaluable ({}), using it as a literal", expression, e.getMessage());
            return expression;
        }
    }

    private static StandardEvaluationContext createContext(String[] paramNames, Object[] args) {
        StandardEvaluationContext context = new StandardEvaluationContext();
        Object[] values = args != null ? args : new Object[0];
        context.setVariable("args", values);
        for (int i = 0; i < values.length; i++) {
            context.setVariable("a" + i, values[i]);
            if (paramNames != null && i < paramNames.length) {
                context.setVariable(paramNames[i], values[i]);
            }
        }
        return context;
    }
}
