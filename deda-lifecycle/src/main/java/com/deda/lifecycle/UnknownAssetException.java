package com.deda.lifecycle;

public class UnknownAssetException extends LifecycleException {

    public UnknownAssetException(AssetId assetId) {
        super(assetId, "Unknown asset: " + assetId);
    }
}
