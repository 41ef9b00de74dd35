package com.example.ranklimiter.presentation.identity;

import com.example.ranklimiter.common.annotation.RankLimit;
import com.example.ranklimiter.common.exception.IdentityMissingException;
import com.example.ranklimiter.domain.model.CallerIdentity;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;

/**
 * SpEL 기반 식별자 추출
 *
 * 컨텍스트 변수:
 * - #request: 현재 HttpServletRequest
 * - #파라미터명: 대상 메서드 인자
 */
@Slf4j
@Component
public class SpelCallerIdentityResolver implements CallerIdentityResolver {

    private final ExpressionParser parser = new SpelExpressionParser();

    @Override
    public CallerIdentity resolve(RankLimit rankLimit, HttpServletRequest request,
                                  String[] parameterNames, Object[] args) {
        EvaluationContext context = createEvaluationContext(request, parameterNames, args);

        String uniqueId = evaluate(rankLimit.identifierExpression(), context);
        if (uniqueId == null || uniqueId.isBlank()) {
            throw new IdentityMissingException(
                    "Caller identifier is empty for expression: " + rankLimit.identifierExpression());
        }

        String group = evaluate(rankLimit.groupExpression(), context);
        return CallerIdentity.of(uniqueId, group);
    }

    private String evaluate(String expression, EvaluationContext context) {
        try {
            Object value = parser.parseExpression(expression).getValue(context);
            return value != null ? value.toString() : null;

        } catch (ParseException | EvaluationException e) {
            log.error("Failed to evaluate caller expression: {}", expression, e);
            throw new IdentityMissingException("Cannot evaluate caller expression: " + expression, e);
        }
    }

    /**
     * SpEL 평가 컨텍스트 생성
     */
    private EvaluationContext createEvaluationContext(HttpServletRequest request,
                                                      String[] parameterNames, Object[] args) {
        StandardEvaluationContext context = new StandardEvaluationContext();

        if (request != null) {
            context.setVariable("request", request);
        }

        // paramNames와 args 길이가 다를 경우 ArrayIndexOutOfBoundsException 방지
        if (parameterNames != null && args != null) {
            for (int i = 0; i < Math.min(parameterNames.length, args.length); i++) {
                context.setVariable(parameterNames[i], args[i]);
            }
        }

        return context;
    }
}
