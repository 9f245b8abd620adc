package com.myorg.eventbus.kafka;

import java.util.Map;

/** Committed offsets of one consumer group on one topic, keyed by partition. */
public record ConsumerGroupOffsets(String groupId, String topic, Map<Integer, Long> offsets) {
}
