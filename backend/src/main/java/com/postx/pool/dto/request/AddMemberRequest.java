package com.postx.pool.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddMemberRequest {
    @NotNull(message = "Social account ID is required")
    private Long socialAccountId;

    @Min(value = 0, message = "Priority must not be negative")
    private Integer priority;

    @Min(value = 1, message = "Weight must be at least 1")
    @Max(value = 1000, message = "Weight must not exceed 1000")
    private Integer weight;
}
