package com.postx.pool.publisher;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Generated post content handed to the publisher as-is. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostContent {
    private String text;
    private List<String> hashtags;
    private List<String> mediaUrls;
    private String link;
    private Map<String, String> platformOptions;
}
