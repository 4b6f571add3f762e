package com.postx.pool.entity;

public enum Platform {
    FACEBOOK("Facebook"),
    INSTAGRAM("Instagram"),
    TIKTOK("TikTok"),
    TWITTER("Twitter / X"),
    LINE("LINE"),
    YOUTUBE("YouTube"),
    THREADS("Threads"),
    LINKEDIN("LinkedIn"),
    PINTEREST("Pinterest");

    private final String displayName;

    Platform(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
