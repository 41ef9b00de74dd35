package com.example.ranklimiter.presentation.interceptor;

import com.example.ranklimiter.application.service.LadderRegistry;
import com.example.ranklimiter.common.annotation.RankLimit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 기동 시 @RankLimit 선언 검증
 *
 * 빈 초기화 중에는 메서드만 수집하고, 모든 싱글톤 생성 후 래더를 만든다.
 * 잘못된 선언은 첫 요청이 아니라 기동 시점에 InvalidConfigurationException으로 실패한다.
 */
@Slf4j
@Component
public class RankLimitAnnotationProcessor implements BeanPostProcessor, SmartInitializingSingleton {

    private final ObjectProvider<LadderRegistry> ladderRegistry;
    private final Map<Method, RankLimit> declarations = new LinkedHashMap<>();

    public RankLimitAnnotationProcessor(ObjectProvider<LadderRegistry> ladderRegistry) {
        this.ladderRegistry = ladderRegistry;
    }

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        Class<?> targetClass = ClassUtils.getUserClass(AopUtils.getTargetClass(bean));
        ReflectionUtils.doWithMethods(targetClass, method -> {
            RankLimit rankLimit = AnnotationUtils.findAnnotation(method, RankLimit.class);
            if (rankLimit != null) {
                declarations.putIfAbsent(method, rankLimit);
            }
        }, ReflectionUtils.USER_DECLARED_METHODS);
        return bean;
    }

    @Override
    public void afterSingletonsInstantiated() {
        LadderRegistry registry = ladderRegistry.getObject();
        declarations.forEach(registry::ladderFor);
        log.info("Validated {} @RankLimit declarations", declarations.size());
    }
}
