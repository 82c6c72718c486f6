package dustin.rental.domains.split.model.entity;

import java.time.LocalDateTime;

import dustin.rental.domains.split.model.ReceiverType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 분배 수신자 엔티티
 * Split Receiver Entity
 *
 * is_locked 가 true 인 수신자(보통 PLATFORM)는 생성 이후 수정/삭제할 수 없다.
 */
@Entity
@Table(name = "split_receivers",
       indexes = {
           @Index(name = "idx_split_receivers_configuration", columnList = "configuration_id")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitReceiver {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "configuration_id", nullable = false)
    private Long configurationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "receiver_type", nullable = false, length = 20)
    private ReceiverType receiverType;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * CPF/CNPJ 등 세금 식별 번호
     */
    @Column(name = "document", length = 20)
    private String document;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "agency_id")
    private Long agencyId;

    /**
     * 결제 게이트웨이 지갑 ID
     */
    @Column(name = "wallet_id", length = 100)
    private String walletId;

    @Column(name = "is_locked", nullable = false)
    private Boolean isLocked;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
