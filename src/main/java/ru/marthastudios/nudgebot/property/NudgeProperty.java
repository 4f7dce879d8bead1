package ru.marthastudios.nudgebot.property;

import lombok.Getter;
import lombok.Setter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
@Getter
@Setter
public class NudgeProperty {
    @Value("${nudge.queue.visibility-timeout-ms:30000}")
    private long queueVisibilityTimeoutMs;

    @Value("${nudge.queue.max-messages-per-poll:50}")
    private int maxMessagesPerPoll;

    @Value("${nudge.state.idle-expiry-hours:24}")
    private long stateIdleExpiryHours;

    @Value("${nudge.smart-group.cache-age-ms:3600000}")
    private long smartGroupCacheAgeMs;
}
