package com.example.ranklimiter.presentation.identity;

import com.example.ranklimiter.common.annotation.RankLimit;
import com.example.ranklimiter.domain.model.CallerIdentity;
import jakarta.servlet.http.HttpServletRequest;

/**
 * 요청에서 CallerIdentity를 추출하는 전략
 *
 * 식별자를 얻지 못하면 IdentityMissingException을 던진다.
 * "unknown" 같은 공용 식별자로 대체하지 않는다.
 */
public interface CallerIdentityResolver {

    /**
     * @param rankLimit 식별자/그룹 표현식을 가진 애노테이션
     * @param request 현재 요청 (웹 요청 밖이면 null)
     * @param parameterNames 대상 메서드 파라미터 이름
     * @param args 대상 메서드 인자
     */
    CallerIdentity resolve(RankLimit rankLimit, HttpServletRequest request,
                           String[] parameterNames, Object[] args);
}
