package com.postx.pool.dto.request;

import com.postx.pool.entity.Platform;
import com.postx.pool.entity.RotationStrategy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreatePoolRequest {
    @NotNull(message = "Brand ID is required")
    @Positive(message = "Brand ID must be positive")
    private Long brandId;

    @NotNull(message = "Platform is required")
    private Platform platform;

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    private String name;

    private String description;

    private RotationStrategy rotationStrategy;

    @Min(value = 1, message = "Cooldown must be at least 1 minute")
    @Max(value = 1440, message = "Cooldown must not exceed 1440 minutes")
    private Integer cooldownMinutes;

    @Min(value = 1, message = "Max posts per day must be at least 1")
    @Max(value = 1000, message = "Max posts per day must not exceed 1000")
    private Integer maxPostsPerDay;

    private Boolean autoFailover;
}
