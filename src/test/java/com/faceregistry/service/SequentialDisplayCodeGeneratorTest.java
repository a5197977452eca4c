package com.faceregistry.service;

import com.faceregistry.exception.IdentityCodeCollisionException;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequentialDisplayCodeGeneratorTest {

    private static final LocalDateTime MINUTE = LocalDateTime.of(2026, 10, 19, 14, 32, 5);

    @Test
    void countsUpWithinAMinute() {
        SequentialDisplayCodeGenerator generator = new SequentialDisplayCodeGenerator("PERSON");

        assertThat(generator.generate(MINUTE)).isEqualTo("PERSON_20261019_1432_0001");
        assertThat(generator.generate(MINUTE.plusSeconds(30))).isEqualTo("PERSON_20261019_1432_0002");
    }

    @Test
    void restartsForANewMinute() {
        SequentialDisplayCodeGenerator generator = new SequentialDisplayCodeGenerator("PERSON");
        generator.generate(MINUTE);
        generator.generate(MINUTE);

        assertThat(generator.generate(MINUTE.plusMinutes(1))).isEqualTo("PERSON_20261019_1433_0001");
    }

    @Test
    void failsOnceTheMinuteIsExhausted() {
        SequentialDisplayCodeGenerator generator = new SequentialDisplayCodeGenerator("P");
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 9999; i++) {
            codes.add(generator.generate(MINUTE));
        }

        assertThat(codes).hasSize(9999).contains("P_20261019_1432_9999");
        assertThatThrownBy(() -> generator.generate(MINUTE))
                .isInstanceOf(IdentityCodeCollisionException.class)
                .hasMessageContaining("20261019_1432");
        assertThat(generator.generate(MINUTE.plusMinutes(1))).isEqualTo("P_20261019_1433_0001");
    }
}
