package com.deda.lifecycle;

/**
 * Base of lifecycle failures. Carries the asset the operation was about.
 */
public class LifecycleException extends RuntimeException {

    private final AssetId assetId;

    public LifecycleException(AssetId assetId, String message) {
        super(message);
        this.assetId = assetId;
    }

    public LifecycleException(AssetId assetId, String message, Throwable cause) {
        super(message, cause);
        this.assetId = assetId;
    }

    /** The asset concerned, or null for store-wide failures. */
    public AssetId getAssetId() {
        return assetId;
    }
}
