package com.postx.pool.entity;

public enum RotationStrategy {
    ROUND_ROBIN,
    RANDOM,
    LEAST_USED,
    PRIORITY
}
