package com.myorg.eventbus.contracts.tenant;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// only the changed fields are set
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TenantUpdatedEventData {
    private String id;
    private String name;
    private String billingEmail;
    private String billingAddress;
    private JsonNode billingInfo; // free-form
}
