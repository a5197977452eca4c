package com.faceregistry.service;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentFingerprintsTest {

    @Test
    void fingerprintIsLowercaseSha256Hex() {
        String fingerprint = ContentFingerprints.of("abc".getBytes(StandardCharsets.US_ASCII));

        assertThat(fingerprint).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void sameBytesGiveSameFingerprintAndOneChangedByteDoesNot() {
        byte[] image = {1, 2, 3, 4, 5};
        byte[] copy = image.clone();
        byte[] changed = image.clone();
        changed[4] = 6;

        assertThat(ContentFingerprints.of(image)).isEqualTo(ContentFingerprints.of(copy));
        assertThat(ContentFingerprints.of(image)).isNotEqualTo(ContentFingerprints.of(changed));
    }

    @Test
    void rejectsMissingContent() {
        assertThatThrownBy(() -> ContentFingerprints.of(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
