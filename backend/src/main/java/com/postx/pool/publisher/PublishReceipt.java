package com.postx.pool.publisher;

public record PublishReceipt(String postId, String url) {}
