package dustin.rental.domains.billing.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 사용량 측정 기능
 * Usage Feature
 *
 * BOLETOS 는 초과 사용량이 아니라 운영 수수료(건당 마크업) 산정에 쓰인다.
 */
@Getter
@RequiredArgsConstructor
public enum UsageFeature {
    INSPECTIONS("inspections", true),
    SETTLEMENTS("settlements", true),
    SCREENINGS("screenings", true),
    API_CALLS("api calls", true),
    BOLETOS("boletos", false);

    private final String label;

    /**
     * 요금제 무료 한도/단가로 초과 요금을 계산하는 기능인지 여부
     */
    private final boolean metered;
}
