package com.myorg.eventbus.contracts.user;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class UserCreatedEventData {
    private String id;
    private String tenantId;
    private String username;
    private String email;
    private String firstName;
    private String lastName;
    private String roleId;
    private String createdBy;
}
