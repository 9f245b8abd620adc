package com.myorg.eventbus.contracts.tenant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TenantActivatedEventData {
    private String id;
    private String activatedAt;
    private String activatedBy;
    private String previousStatus;
}
