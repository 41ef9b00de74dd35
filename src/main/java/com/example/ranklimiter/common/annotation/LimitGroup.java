package com.example.ranklimiter.common.annotation;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 한 등급의 규칙 묶음 (AND)
 */
@Target({})
@Retention(RetentionPolicy.RUNTIME)
public @interface LimitGroup {

    Limit[] value();
}
