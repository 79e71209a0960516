package com.example.backup.infrastructure.messaging;

import com.example.backup.domain.event.BackupEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Kafka 알림 디스패처 (key = 스토어 이름, value = JSON 이벤트)
 */
@Slf4j
@RequiredArgsConstructor
public class KafkaNotificationDispatcher implements NotificationDispatcher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    @Override
    public void dispatch(BackupEvent event) {
        try {
            String eventJson = objectMapper.writeValueAsString(event);

            kafkaTemplate.send(topic, event.getStoreName(), eventJson)
                    .whenComplete((result, ex) -> {
                        if (ex == null) {
                            log.debug("Backup event published: type={}, store={}, id={}",
                                    event.getEventType(), event.getStoreName(), event.getEventId());
                        } else {
                            log.error("Failed to publish backup event: type={}, store={}, error={}",
                                    event.getEventType(), event.getStoreName(), ex.getMessage());
                        }
                    });

        } catch (JsonProcessingException e) {
            log.error("Error serializing backup event: type={}, store={}", event.getEventType(), event.getStoreName(), e);
        } catch (RuntimeException e) {
            log.error("Error publishing backup event: type={}, store={}", event.getEventType(), event.getStoreName(), e);
        }
    }
}
