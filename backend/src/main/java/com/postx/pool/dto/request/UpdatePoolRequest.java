package com.postx.pool.dto.request;

import com.postx.pool.entity.RotationStrategy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Partial update: null fields are left unchanged. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePoolRequest {
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

    private Boolean active;
}
