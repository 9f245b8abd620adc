package com.myorg.eventbus.contracts.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DomainVerifiedEventData {
    private String id;
    private String tenantId;
    private String domainName;
    private String verifiedAt;
    private String sslCertificateExpiresAt; // optional
}
