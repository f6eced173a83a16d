package com.example.eventscheduler.service.alert;

import com.example.eventscheduler.config.SlackProperties;
import com.slack.api.Slack;
import com.slack.api.model.Attachment;
import com.slack.api.model.Field;
import com.slack.api.webhook.Payload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Sends an alert to Slack when a schedule moves to FAILED.
 * <p>
 * A FAILED schedule never fires again until an operator updates or retries it,
 * so every transition is reported to the on-call channel.
 */
@Slf4j
@Service
public class SlackAlertService {

    private final SlackProperties slackProperties;
    private final Clock clock;
    private final Slack slack = Slack.getInstance();

    @Value("${spring.application.name:event-scheduler}")
    private String applicationName;

    public SlackAlertService(SlackProperties slackProperties, Clock clock) {
        this.slackProperties = slackProperties;
        this.clock = clock;
    }

    /**
     * Alert that a schedule was moved to FAILED.
     * Runs asynchronously to not block delivery threads.
     *
     * @param fireTime occurrence whose delivery was given up, null when the rule itself is broken
     */
    @Async
    public void sendScheduleFailedAlert(UUID scheduleId, String scheduleName, Instant fireTime, int attempts, String error) {
        if (!isConfigured()) {
            log.warn("Slack alerting is disabled or webhook URL not configured. Schedule {} failed but no alert was sent.", scheduleName);
            return;
        }

        try {
            var response = slack.send(slackProperties.getWebhookUrl(), buildFailurePayload(scheduleId, scheduleName, fireTime, attempts, error));

            if (response.getCode() != 200) {
                log.error("Failed to send Slack alert. Response code: {}, body: {}", response.getCode(), response.getBody());
            } else {
                log.info("Slack alert sent for failed schedule {}", scheduleName);
            }
        } catch (Exception e) {
            log.error("Error sending Slack alert for schedule {}: {}", scheduleName, e.getMessage(), e);
        }
    }

    boolean isConfigured() {
        return slackProperties.isEnabled() && slackProperties.getWebhookUrl() != null && !slackProperties.getWebhookUrl().isBlank();
    }

    Payload buildFailurePayload(UUID scheduleId, String scheduleName, Instant fireTime, int attempts, String error) {
        var fields = new ArrayList<Field>(List.of(
                Field.builder()
                        .title("Schedule ID")
                        .value(scheduleId.toString())
                        .valueShortEnough(true)
                        .build(),
                Field.builder()
                        .title("Schedule")
                        .value(scheduleName)
                        .valueShortEnough(true)
                        .build()));

        if (fireTime != null) {
            fields.add(Field.builder()
                    .title("Occurrence")
                    .value(fireTime.toString())
                    .valueShortEnough(true)
                    .build());
            fields.add(Field.builder()
                    .title("Attempts")
                    .value(String.valueOf(attempts))
                    .valueShortEnough(true)
                    .build());
        }

        fields.add(Field.builder()
                .title("Last Error")
                .value("```" + truncate(error != null ? error : "Unknown error", 400) + "```")
                .valueShortEnough(false)
                .build());

        return Payload.builder()
                .channel(slackProperties.getChannel())
                .username(applicationName)
                .iconEmoji(":rotating_light:")
                .text(":rotating_light: *Schedule Failed - Manual Intervention Required*")
                .attachments(List.of(
                        Attachment.builder()
                                .color("danger")
                                .title(scheduleName)
                                .fields(fields)
                                .footer(applicationName + " | Update or retry the schedule to re-activate it")
                                .ts(String.valueOf(clock.instant().getEpochSecond()))
                                .build()
                ))
                .build();
    }

    private String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 3) + "...";
    }
}
