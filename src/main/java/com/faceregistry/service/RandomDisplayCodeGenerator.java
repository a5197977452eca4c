package com.faceregistry.service;

import java.time.LocalDateTime;
import java.util.Random;

public class RandomDisplayCodeGenerator implements DisplayCodeGenerator {

    private final String prefix;
    private final Random random;

    public RandomDisplayCodeGenerator(String prefix, Random random) {
        this.prefix = prefix;
        this.random = random;
    }

    @Override
    public String generate(LocalDateTime createdAt) {
        return DisplayCodes.format(prefix, DisplayCodes.bucket(createdAt), random.nextInt(DisplayCodes.SUFFIX_SPACE));
    }
}
