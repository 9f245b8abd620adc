package com.myorg.eventbus.contracts.tenant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TenantDeletedEventData {
    private String id;
    private String reason;
    private String deletedAt;
    private String deletedBy;
    private int dataRetentionPeriod; // days
}
