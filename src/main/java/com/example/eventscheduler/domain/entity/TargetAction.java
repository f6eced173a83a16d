package com.example.eventscheduler.domain.entity;

import com.example.eventscheduler.domain.enums.ActionType;
import jakarta.persistence.*;
import lombok.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Descriptor of what a schedule triggers when it fires.
 * <p>
 * The action type selects the handler; the remaining fields are interpreted by that handler.
 * For HTTP_CALLBACK: method, url, headers and a payload template rendered per trigger.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TargetAction {

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 30)
    private ActionType actionType;

    @Column(name = "action_method", length = 10)
    private String method;

    @Column(name = "action_url", nullable = false, length = 2000)
    private String url;

    @Convert(converter = StringMapJsonConverter.class)
    @Column(name = "action_headers", length = 4000)
    @Builder.Default
    private Map<String, String> headers = new HashMap<>();

    /**
     * Body template; supports ${scheduleId}, ${scheduleName}, ${fireTime} and ${attempt}
     */
    @Column(name = "action_payload_template", length = 4000)
    private String payloadTemplate;
}
