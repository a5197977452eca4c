package com.faceregistry.service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprint of raw image bytes: lowercase hex SHA-256.
 */
public final class ContentFingerprints {

    private ContentFingerprints() {
    }

    public static String of(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("Image content is required");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
