package com.delta.gapreview.collab;

import com.delta.gapreview.config.ReviewProperties;
import com.delta.gapreview.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier: writes the message to the application log. Delivery channels plug in by
 * providing another {@link NotificationClient} bean.
 */
@Component
public class LoggingNotificationClient implements NotificationClient {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationClient.class);

    private final ReviewProperties.Notification notification;

    public LoggingNotificationClient(ReviewProperties properties) {
        this.notification = properties.getNotification();
    }

    @Override
    public String sendApprovalRequest(String runId, String summary) {
        String link = reviewLink(runId);
        log.info("Approval requested run={} link={} summary={}", runId, link, summary);
        return "log:" + HashUtils.sha256Hex(runId + "|approval").substring(0, 16);
    }

    @Override
    public void sendCompletion(String runId, String summary) {
        log.info("Run completed run={} summary={}", runId, summary);
    }

    private String reviewLink(String runId) {
        String base = notification.getReviewBaseUrl() == null ? "" : notification.getReviewBaseUrl();
        return base.endsWith("/") ? base + runId : base + "/" + runId;
    }
}
