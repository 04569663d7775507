package com.company.reporting.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAlertRequest {
    @NotBlank(message = "User ID is required")
    private String userId;

    private String reason;
}
