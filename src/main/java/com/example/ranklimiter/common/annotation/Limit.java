package com.example.ranklimiter.common.annotation;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 단일 규칙 선언
 *
 * hits + batchTime (COUNT) 또는 delay (DELAY) 중 하나.
 * 시간 값은 Spring Boot Duration 표기 ("500ms", "60s", "10m", "PT1H").
 */
@Target({})
@Retention(RetentionPolicy.RUNTIME)
public @interface Limit {

    /** 0이면 미지정 */
    int hits() default 0;

    String batchTime() default "";

    String delay() default "";

    String blockTime() default "300s";

    boolean increaseRank() default true;

    String message() default "";

    String reason() default "";

    /** 비우면 모든 그룹 */
    String[] groups() default {};
}
