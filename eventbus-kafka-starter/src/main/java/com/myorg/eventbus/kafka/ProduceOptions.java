package com.myorg.eventbus.kafka;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProduceOptions {
    // defaults to the envelope id
    private String key;
    private Map<String, String> headers;
    // null lets the partitioner hash the key
    private Integer partition;

    public static ProduceOptions none() {
        return new ProduceOptions();
    }
}
