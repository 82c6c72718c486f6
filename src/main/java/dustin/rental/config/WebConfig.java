package dustin.rental.config;

import java.util.List;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import dustin.rental.shared.security.ActorContextArgumentResolver;
import lombok.RequiredArgsConstructor;

/**
 * 웹 MVC 설정
 * Web MVC Configuration
 *
 * 역할:
 * - 컨트롤러 메서드의 ActorContext 파라미터 해석기 등록
 */
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

    private final ActorContextArgumentResolver actorContextArgumentResolver;

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(actorContextArgumentResolver);
    }
}
