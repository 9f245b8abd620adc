package com.myorg.eventbus.contracts.tenant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TenantCreatedEventData {
    private String id;
    private String name;
    private String schemaName;
    private String packageId;
    private String billingEmail;
    private String subscriptionStartDate;
    private List<String> initialModules;
}
