package com.example.ranklimiter.common.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 등급 기반 Rate Limiting을 적용하기 위한 애노테이션
 *
 * ranks(인라인) 또는 ladder(설정 파일의 이름) 중 정확히 하나를 지정해야 한다.
 * 잘못된 조합은 애플리케이션 기동 시 실패한다.
 *
 * 사용 예:
 * <pre>
 * &#64;RankLimit(endpoint = "orders", ranks = {
 *         &#64;LimitGroup(&#64;Limit(hits = 1, batchTime = "60s", blockTime = "60s")),
 *         &#64;LimitGroup(&#64;Limit(hits = 1, batchTime = "60s", blockTime = "600s"))
 * })
 * public ResponseEntity&lt;?&gt; createOrder() { ... }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RankLimit {

    /**
     * 저장소 네임스페이스. 비우면 "HTTP메서드:요청경로"
     */
    String endpoint() default "";

    /**
     * rank-limit.ladders 에 정의된 래더 이름
     */
    String ladder() default "";

    /**
     * 인라인 래더. 0번이 가장 느슨한 등급
     */
    LimitGroup[] ranks() default {};

    /**
     * 요청자 uniqueId 추출 (SpEL)
     * 예: "#request.remoteAddr", "#request.getHeader('X-Api-Key')"
     */
    String identifierExpression() default "#request.remoteAddr";

    /**
     * 요청자 group 추출 (SpEL)
     */
    String groupExpression() default "'default'";
}
