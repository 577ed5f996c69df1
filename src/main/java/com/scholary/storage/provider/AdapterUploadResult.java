package com.scholary.storage.provider;

/** Where an uploaded object landed. */
public record AdapterUploadResult(
    String url, String key, long size, String etag, String provider) {}
