package com.purchasingpower.hsn.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class SessionProperties {

    /**
     * Sessions without a turn or lookup for this long are dropped.
     */
    @NotNull
    private Duration idleTimeout = Duration.ofMinutes(30);

    /**
     * Upper bound on live sessions; the least recently used go first.
     */
    @Min(1)
    private long maxSessions = 10_000;
}
