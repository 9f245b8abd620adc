package com.myorg.eventbus.kafka;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Per-subscription overrides. Null fields fall back to {@code eventbus.kafka.consumer.*}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SubscribeOptions {
    // null -> "<serviceName>-<topic>-group"
    private String groupId;
    private Boolean autoCommit;
    // only applies when the group has no committed offset yet
    private Boolean fromBeginning;
    private Integer maxBytesPerPartition;
    private Duration sessionTimeout;
    // false accepts any JSON object, e.g. dead letters
    @Builder.Default
    private boolean strictEnvelope = true;

    public static SubscribeOptions defaults() {
        return SubscribeOptions.builder().build();
    }
}
