package com.postx.pool.exception;

import com.postx.pool.entity.Platform;
import lombok.Getter;

@Getter
public class PoolNotConfiguredException extends ResourceNotFoundException {
    private final Long brandId;
    private final Platform platform;

    public PoolNotConfiguredException(Long brandId, Platform platform) {
        super(String.format("No active account pool configured for brand %d on %s", brandId, platform));
        this.brandId = brandId;
        this.platform = platform;
    }
}
