package dustin.rental.domains.billing.config;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import dustin.rental.domains.billing.model.UsageFeature;
import lombok.Data;

/**
 * 청구 요금제 설정
 * Billing Plan Properties
 *
 * 역할:
 * - 요금제별 기능 무료 한도와 초과 단가
 * - 보레토(boleto) 건당 운영 수수료 마크업
 * - 범위별 요금제 지정 (지정 없으면 defaultPlan)
 *
 * 설정 방법:
 * - application.yml 의 billing.* 에서 설정
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "billing")
public class BillingPlanProperties {

    /**
     * 범위에 지정된 요금제가 없을 때 사용
     */
    private String defaultPlan = "FREE";

    /**
     * 보레토(boleto) 1건당 운영 수수료
     */
    private BigDecimal boletoMarkup = new BigDecimal("1.51");

    /**
     * 청구 납부 기한 (다음 달 N일)
     */
    private int dueDayOfMonth = 10;

    /**
     * 범위 키(agency:3, owner:12) → 요금제 이름
     */
    private Map<String, String> assignments = new HashMap<>();

    /**
     * 요금제 이름 → 한도/단가
     */
    private Map<String, PlanLimits> plans = new HashMap<>();

    public PlanLimits getPlanLimits(String planName) {
        PlanLimits limits = plans.get(planName);
        return limits != null ? limits : new PlanLimits();
    }

    /**
     * 요금제 한도
     * Plan Limits
     */
    @Data
    public static class PlanLimits {

        /**
         * 기능별 월 무료 한도
         */
        private Map<UsageFeature, Integer> freeLimits = new EnumMap<>(UsageFeature.class);

        /**
         * 기능별 초과 1건당 단가
         */
        private Map<UsageFeature, BigDecimal> unitPrices = new EnumMap<>(UsageFeature.class);

        public int freeLimit(UsageFeature feature) {
            Integer limit = freeLimits.get(feature);
            return limit == null ? 0 : limit;
        }

        public BigDecimal unitPrice(UsageFeature feature) {
            BigDecimal price = unitPrices.get(feature);
            return price == null ? BigDecimal.ZERO : price;
        }
    }
}
