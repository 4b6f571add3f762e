package com.postx.pool.dto.request;

import com.postx.pool.entity.Platform;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchRequest {
    @NotNull(message = "Brand ID is required")
    @Positive(message = "Brand ID must be positive")
    private Long brandId;

    @NotNull(message = "Platform is required")
    private Platform platform;

    @NotBlank(message = "Text is required")
    @Size(max = 10000, message = "Text must not exceed 10000 characters")
    private String text;

    private List<String> hashtags;

    @Size(max = 20, message = "At most 20 media URLs are allowed")
    private List<String> mediaUrls;

    private String link;

    private Map<String, String> platformOptions;

    // Per-attempt publish timeout; capped at the configured publish timeout
    @Positive(message = "Timeout must be positive")
    private Long timeoutMs;
}
