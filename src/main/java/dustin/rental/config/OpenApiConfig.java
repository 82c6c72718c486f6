package dustin.rental.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

/**
 * Swagger 문서 설정
 * OpenAPI Documentation Configuration
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI rentalBillingOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Rental Billing Service API")
                        .description("분할 설정(Split Configuration) 및 월별 청구 주기(Billing Cycle) API")
                        .version("v1"));
    }
}
