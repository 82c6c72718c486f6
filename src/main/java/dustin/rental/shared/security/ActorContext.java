package dustin.rental.shared.security;

import java.util.EnumSet;
import java.util.Set;

import dustin.rental.shared.exception.ForbiddenOperationException;
import lombok.Getter;

/**
 * 요청 행위자 정보
 * Actor Context
 *
 * 역할:
 * - 감사 로그의 performedBy 값 제공
 * - 작업별 권한 확인
 */
@Getter
public class ActorContext {

    public static final String SYSTEM_ACTOR = "SYSTEM";

    private final String actorId;
    private final Set<Capability> capabilities;

    public ActorContext(String actorId, Set<Capability> capabilities) {
        this.actorId = actorId;
        this.capabilities = capabilities.isEmpty()
                ? EnumSet.noneOf(Capability.class)
                : EnumSet.copyOf(capabilities);
    }

    public static ActorContext system() {
        return new ActorContext(SYSTEM_ACTOR, EnumSet.allOf(Capability.class));
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    public void require(Capability capability) {
        if (!has(capability)) {
            throw new ForbiddenOperationException(
                    "Actor " + actorId + " lacks capability " + capability);
        }
    }
}
