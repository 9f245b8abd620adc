package com.myorg.eventbus.contracts.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DomainCreatedEventData {
    private String id;
    private String tenantId;
    private String domainName;
    @JsonProperty("isDefault")
    private boolean isDefault;
    private boolean sslEnabled;
    private String verificationMethod;
    private String verificationToken;
}
