package com.shieldsync.common;

import lombok.Getter;

/**
 * Thrown when an operation names an asset that is not configured under shieldsync.assets.
 */
@Getter
public class UnknownAssetException extends PoolClientException {

    public static final String ERROR_CODE = "UNKNOWN_ASSET";

    private final String asset;

    public UnknownAssetException(String asset) {
        super(ERROR_CODE, "Asset is not supported: " + asset);
        this.asset = asset;
    }
}
