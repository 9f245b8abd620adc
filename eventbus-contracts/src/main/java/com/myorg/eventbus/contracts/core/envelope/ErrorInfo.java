package com.myorg.eventbus.contracts.core.envelope;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorInfo {
    private String code; // dead-letter reason
    private String message;
    private String stack;
    private String time; // ISO-8601, when the message was dead-lettered
}
