package com.pathtopology.engine.service;

import com.pathtopology.engine.dto.SegmentChangedNotice;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Pushes committed segment changes to STOMP subscribers.
 *
 * Listens after commit only, so a rolled-back write is never announced.
 * The write is already durable at this point, so a broadcast failure is
 * logged and not rethrown.
 */
@Component
@Slf4j
public class TopologyChangeNotifier {

    private final SimpMessagingTemplate messagingTemplate;
    private final String topic;

    public TopologyChangeNotifier(
        SimpMessagingTemplate messagingTemplate,
        @Value("${topology.websocket.topic:/topic/topology}") String topic
    ) {
        this.messagingTemplate = messagingTemplate;
        this.topic = topic;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSegmentChanged(SegmentChangedNotice notice) {
        try {
            messagingTemplate.convertAndSend(topic, notice);
            log.debug("Broadcast {}", notice.toLogString());
        } catch (MessagingException e) {
            log.error("Failed to broadcast {}", notice.toLogString(), e);
        }
    }
}
