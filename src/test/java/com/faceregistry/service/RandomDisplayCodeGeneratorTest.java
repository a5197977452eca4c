package com.faceregistry.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RandomDisplayCodeGeneratorTest {

    @Test
    void producesMinuteBucketWithFourDigitSuffix() {
        RandomDisplayCodeGenerator generator = new RandomDisplayCodeGenerator("PERSON", new Random(42));
        LocalDateTime createdAt = LocalDateTime.of(2026, 1, 2, 3, 4, 59);

        for (int i = 0; i < 100; i++) {
            assertThat(generator.generate(createdAt)).matches("PERSON_20260102_0304_\\d{4}");
        }
    }
}
