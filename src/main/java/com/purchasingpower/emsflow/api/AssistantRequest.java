package com.purchasingpower.emsflow.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the assistant query endpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssistantRequest {

    /**
     * The user's natural-language request.
     */
    @NotBlank(message = "query is required")
    private String query;

    /**
     * Optional caller-chosen id, usable with the cancel endpoint while the request runs.
     */
    private String requestId;
}
