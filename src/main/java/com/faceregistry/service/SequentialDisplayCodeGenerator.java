package com.faceregistry.service;

import com.faceregistry.exception.IdentityCodeCollisionException;

import java.time.LocalDateTime;

/**
 * Hands out 0001, 0002, ... within each minute bucket and fails once the bucket is used up.
 */
public class SequentialDisplayCodeGenerator implements DisplayCodeGenerator {

    private final String prefix;
    private String currentBucket;
    private int lastSuffix;

    public SequentialDisplayCodeGenerator(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public synchronized String generate(LocalDateTime createdAt) {
        String bucket = DisplayCodes.bucket(createdAt);
        if (!bucket.equals(currentBucket)) {
            currentBucket = bucket;
            lastSuffix = 0;
        }
        if (lastSuffix + 1 >= DisplayCodes.SUFFIX_SPACE) {
            throw new IdentityCodeCollisionException("Display code suffixes exhausted for minute " + bucket);
        }
        lastSuffix++;
        return DisplayCodes.format(prefix, bucket, lastSuffix);
    }
}
