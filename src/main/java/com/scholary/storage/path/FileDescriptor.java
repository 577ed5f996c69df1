package com.scholary.storage.path;

/**
 * What the key generator needs to know about a file.
 *
 * @param originalName file name as supplied by the uploader
 * @param mimeType MIME type, may be null
 * @param uploaderId id of the uploading user, may be null
 */
public record FileDescriptor(String originalName, String mimeType, String uploaderId) {}
