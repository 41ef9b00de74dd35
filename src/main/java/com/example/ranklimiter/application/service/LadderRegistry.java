package com.example.ranklimiter.application.service;

import com.example.ranklimiter.common.annotation.RankLimit;
import com.example.ranklimiter.common.exception.InvalidConfigurationException;
import com.example.ranklimiter.config.RankLimitProperties;
import com.example.ranklimiter.domain.factory.RankLadderFactory;
import com.example.ranklimiter.domain.model.RankLadder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 래더 저장소
 *
 * - 이름 있는 래더: rank-limit.ladders 에서 기동 시 생성 (잘못되면 기동 실패)
 * - 메서드 래더: @RankLimit 선언에서 생성, 메서드 단위 캐싱
 * - 엔드포인트 래더: 관리 API(등급 이동)에서 래더 크기를 알기 위한 매핑
 */
@Slf4j
@Component
public class LadderRegistry {

    private final RankLadderFactory ladderFactory;
    private final Map<String, RankLadder> namedLadders = new ConcurrentHashMap<>();
    private final Map<Method, RankLadder> methodLadders = new ConcurrentHashMap<>();
    private final Map<String, RankLadder> endpointLadders = new ConcurrentHashMap<>();

    public LadderRegistry(RankLadderFactory ladderFactory, RankLimitProperties properties) {
        this.ladderFactory = ladderFactory;
        properties.getLadders().forEach((name, ranks) -> {
            namedLadders.put(name, ladderFactory.fromProperties(name, ranks));
            log.info("Registered ladder '{}' with {} ranks", name, ranks.size());
        });
    }

    public Optional<RankLadder> named(String name) {
        return Optional.ofNullable(namedLadders.get(name));
    }

    /**
     * 메서드의 래더를 반환, 처음이면 생성 후 캐싱
     */
    public RankLadder ladderFor(Method method, RankLimit rankLimit) {
        return methodLadders.computeIfAbsent(method, m -> {
            RankLadder ladder = build(m, rankLimit);
            if (!rankLimit.endpoint().isBlank()) {
                bindEndpoint(rankLimit.endpoint(), ladder);
            }
            return ladder;
        });
    }

    public void bindEndpoint(String endpoint, RankLadder ladder) {
        RankLadder previous = endpointLadders.putIfAbsent(endpoint, ladder);
        if (previous != null && !previous.equals(ladder)) {
            log.warn("Endpoint '{}' is shared by different ladders, keeping the first one", endpoint);
        }
    }

    public Optional<RankLadder> ladderForEndpoint(String endpoint) {
        return Optional.ofNullable(endpointLadders.get(endpoint));
    }

    private RankLadder build(Method method, RankLimit rankLimit) {
        boolean hasName = !rankLimit.ladder().isBlank();
        boolean hasRanks = rankLimit.ranks().length > 0;
        String where = method.getDeclaringClass().getSimpleName() + "#" + method.getName();

        if (hasName == hasRanks) {
            throw new InvalidConfigurationException(
                    "@RankLimit on " + where + " must declare exactly one of 'ladder' or 'ranks'");
        }
        if (hasName) {
            return named(rankLimit.ladder()).orElseThrow(() -> new InvalidConfigurationException(
                    "@RankLimit on " + where + " refers to unknown ladder '" + rankLimit.ladder() + "'"));
        }
        try {
            return ladderFactory.fromAnnotation(rankLimit.ranks());
        } catch (InvalidConfigurationException e) {
            throw new InvalidConfigurationException("@RankLimit on " + where + ": " + e.getMessage(), e);
        }
    }
}
