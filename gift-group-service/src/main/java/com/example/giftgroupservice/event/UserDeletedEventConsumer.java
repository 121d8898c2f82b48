package com.example.giftgroupservice.event;

import com.example.common.events.UserDeletedEvent;
import com.example.giftgroupservice.dto.response.CascadeReport;
import com.example.giftgroupservice.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Kafka Consumer for user.deleted events.
 * When an identity is deleted upstream, run the account-deletion cascade for it.
 * Redelivered events find nothing left to delete.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "spring.kafka.enabled", havingValue = "true")
public class UserDeletedEventConsumer {

    private final UserService userService;

    @KafkaListener(
        topics = "${app.kafka.topics.user-deleted:user.deleted}",
        groupId = "${spring.kafka.consumer.group-id:gift-group-service}",
        containerFactory = "userDeletedEventKafkaListenerContainerFactory"
    )
    public void handleUserDeleted(UserDeletedEvent event) {
        log.info("Received user.deleted event: userId={}, eventId={}", event.getUserId(), event.getEventId());

        if (event.getUserId() == null) {
            log.warn("Ignoring user.deleted event without userId: eventId={}", event.getEventId());
            return;
        }

        CascadeReport report = userService.deleteAccount(event.getUserId());
        if (report.totalRows() == 0) {
            log.info("Nothing to delete for userId={}", event.getUserId());
            return;
        }

        log.info("Deleted {} rows for userId={} ({} groups, {} lists, {} claims)",
                report.totalRows(), event.getUserId(),
                report.getGroups().size(), report.getLists().size(), report.getClaims().size());
    }
}
