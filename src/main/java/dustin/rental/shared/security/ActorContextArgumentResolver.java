package dustin.rental.shared.security;

import java.util.EnumSet;
import java.util.Set;

import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import dustin.rental.shared.exception.ForbiddenOperationException;
import lombok.extern.slf4j.Slf4j;

/**
 * 요청 헤더로부터 ActorContext 생성
 * Actor Context Argument Resolver
 *
 * 헤더:
 * - X-Actor-Id: 행위자 식별자 (필수)
 * - X-Actor-Capabilities: 쉼표로 구분된 권한 목록
 */
@Slf4j
@Component
public class ActorContextArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String ACTOR_ID_HEADER = "X-Actor-Id";
    public static final String CAPABILITIES_HEADER = "X-Actor-Capabilities";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ActorContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String actorId = webRequest.getHeader(ACTOR_ID_HEADER);
        if (actorId == null || actorId.isBlank()) {
            throw new ForbiddenOperationException("Missing " + ACTOR_ID_HEADER + " header");
        }
        return new ActorContext(actorId.trim(), parseCapabilities(webRequest.getHeader(CAPABILITIES_HEADER)));
    }

    private Set<Capability> parseCapabilities(String header) {
        Set<Capability> capabilities = EnumSet.noneOf(Capability.class);
        if (header == null || header.isBlank()) {
            return capabilities;
        }
        for (String token : header.split(",")) {
            String name = token.trim().toUpperCase();
            if (name.isEmpty()) {
                continue;
            }
            try {
                capabilities.add(Capability.valueOf(name));
            } catch (IllegalArgumentException e) {
                log.warn("[ActorContextArgumentResolver] 알 수 없는 권한 무시: {}", name);
            }
        }
        return capabilities;
    }
}
