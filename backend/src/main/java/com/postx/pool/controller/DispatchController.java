package com.postx.pool.controller;

import com.postx.pool.dto.ApiResponse;
import com.postx.pool.dto.request.DispatchRequest;
import com.postx.pool.publisher.PostContent;
import com.postx.pool.service.dispatch.DispatchResult;
import com.postx.pool.service.dispatch.DispatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Publishes content through the brand's account pool for a platform */
@Slf4j
@RestController
@RequestMapping("/api/v1/dispatch")
@RequiredArgsConstructor
@Tag(name = "Dispatch", description = "Publish content through a rotating account pool")
public class DispatchController {

    private final DispatchService dispatchService;

    /**
     * PUBLISHED answers 200 and a content-level rejection 422. Missing pools, exhausted pools and a
     * full publish executor are reported by the exception handler.
     */
    @PostMapping
    @Operation(
            summary = "Dispatch a post",
            description =
                    "Selects an account from the brand's pool, publishes, and fails over to other"
                            + " accounts on per-account errors")
    public ResponseEntity<ApiResponse<DispatchResult>> dispatch(
            @Valid @RequestBody DispatchRequest request) {
        PostContent content =
                PostContent.builder()
                        .text(request.getText())
                        .hashtags(request.getHashtags())
                        .mediaUrls(request.getMediaUrls())
                        .link(request.getLink())
                        .platformOptions(request.getPlatformOptions())
                        .build();

        Duration timeout =
                request.getTimeoutMs() == null ? null : Duration.ofMillis(request.getTimeoutMs());
        DispatchResult result =
                dispatchService.dispatch(
                        request.getBrandId(), request.getPlatform(), content, timeout);

        return switch (result.getStatus()) {
            case PUBLISHED -> ResponseEntity.ok(ApiResponse.success(result, "Post published"));
            case CONTENT_REJECTED ->
                    ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                            .body(failure(result, "CONTENT_REJECTED"));
        };
    }

    private static ApiResponse<DispatchResult> failure(DispatchResult result, String errorCode) {
        return ApiResponse.<DispatchResult>builder()
                .success(false)
                .data(result)
                .errorCode(errorCode)
                .message(result.getErrorMessage())
                .timestamp(LocalDateTime.now())
                .build();
    }
}
