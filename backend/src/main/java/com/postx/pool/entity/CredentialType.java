package com.postx.pool.entity;

public enum CredentialType {
    ACCESS_TOKEN,
    REFRESH_TOKEN
}
