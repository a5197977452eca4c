package com.faceregistry.service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

final class DisplayCodes {

    static final int SUFFIX_SPACE = 10_000;

    private static final DateTimeFormatter MINUTE_BUCKET = DateTimeFormatter.ofPattern("yyyyMMdd_HHmm");

    private DisplayCodes() {
    }

    static String bucket(LocalDateTime createdAt) {
        return createdAt.format(MINUTE_BUCKET);
    }

    static String format(String prefix, String bucket, int suffix) {
        return String.format("%s_%s_%04d", prefix, bucket, suffix);
    }
}
