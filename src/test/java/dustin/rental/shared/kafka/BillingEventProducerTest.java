package dustin.rental.shared.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.test.util.ReflectionTestUtils;

/**
 * 청구 이벤트 발행자 테스트
 * Billing Event Producer Test
 */
@ExtendWith(OutputCaptureExtension.class)
class BillingEventProducerTest {

    private static final String TOPIC = "billing-payment-requests";

    private KafkaTemplate<String, String> kafkaTemplate;
    private BillingEventProducer producer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        producer = new BillingEventProducer(kafkaTemplate);
        ReflectionTestUtils.setField(producer, "paymentRequestTopic", TOPIC);
        ReflectionTestUtils.setField(producer, "chargeAlertTopic", "billing-charge-alerts");
    }

    @Test
    @DisplayName("브로커가 거절한 발행은 실패 로그를 남기고 실패한 future 반환")
    void logsBrokerRejection(CapturedOutput output) {
        when(kafkaTemplate.send(TOPIC, "AB12CD34", "{}"))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker rejected")));

        CompletableFuture<SendResult<String, String>> sent = producer.send(TOPIC, "AB12CD34", "{}");

        assertThatThrownBy(sent::join)
                .isInstanceOf(CompletionException.class)
                .hasRootCauseMessage("broker rejected");
        assertThat(output.getAll()).contains("topic=" + TOPIC, "key=AB12CD34", "broker rejected");
    }

    @Test
    @DisplayName("결제 요청은 청구 토큰을 키로 결제 요청 토픽에 전송")
    void sendsPaymentRequest() {
        ProducerRecord<String, String> record = new ProducerRecord<>(TOPIC, "EF56GH78", "{\"amount\":10}");
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 42L, 0, 0L, 8, 13);
        when(kafkaTemplate.send(TOPIC, "EF56GH78", "{\"amount\":10}"))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(record, metadata)));

        SendResult<String, String> result = producer.send(TOPIC, "EF56GH78", "{\"amount\":10}").join();

        assertThat(result.getRecordMetadata().offset()).isEqualTo(42L);
        verify(kafkaTemplate).send(TOPIC, "EF56GH78", "{\"amount\":10}");
    }
}
