package com.hostwatch.service;

import com.hostwatch.dto.CollectionResult;
import com.hostwatch.dto.RefreshStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

/**
 * Pushes cycle outcomes to WebSocket subscribers.
 */
@Service
public class SnapshotBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(SnapshotBroadcaster.class);

    static final String SNAPSHOT_TOPIC = "/topic/snapshot";
    static final String NOTIFICATION_TOPIC = "/topic/notifications";
    static final String STATUS_TOPIC = "/topic/refresh-status";

    private final SimpMessagingTemplate messaging;

    public SnapshotBroadcaster(SimpMessagingTemplate messaging) {
        this.messaging = messaging;
    }

    public void publish(CollectionResult result) {
        try {
            if (result.isSuccess()) {
                messaging.convertAndSend(SNAPSHOT_TOPIC, result.snapshot());
            } else {
                messaging.convertAndSend(NOTIFICATION_TOPIC, result.error());
            }
        } catch (Exception e) {
            log.warn("Failed to publish collection result", e);
        }
    }

    public void publishStatus(RefreshStatus status) {
        try {
            messaging.convertAndSend(STATUS_TOPIC, status);
        } catch (Exception e) {
            log.warn("Failed to publish refresh status", e);
        }
    }
}
