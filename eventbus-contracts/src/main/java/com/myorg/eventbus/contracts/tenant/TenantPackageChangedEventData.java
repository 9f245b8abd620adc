package com.myorg.eventbus.contracts.tenant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TenantPackageChangedEventData {
    private String id;
    private String previousPackageId;
    private String newPackageId;
    private String effectiveDate;
    private String changedBy;
    private String reason;
}
