package com.myorg.eventbus.contracts.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DomainDisabledEventData {
    private String id;
    private String tenantId;
    private String domainName;
    private String reason;
    private String disabledAt;
    private String disabledBy;
}
