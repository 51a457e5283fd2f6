package com.bookedbarber.ratelimit.cooldown;

import java.time.Instant;

public record CooldownEntry(TriggerType triggerType, Instant lastTriggeredAt, int cooldownMinutes) {

    public Instant availableAt() {
        return lastTriggeredAt.plusSeconds(cooldownMinutes * 60L);
    }
}
