package com.faceregistry.entity;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingConverterTest {

    private final EmbeddingConverter converter = new EmbeddingConverter();

    @Test
    void storesFloat32LittleEndian() {
        byte[] blob = converter.convertToDatabaseColumn(new float[]{1.0f});

        // 1.0f is 0x3F800000
        assertThat(blob).containsExactly(new byte[]{0x00, 0x00, (byte) 0x80, 0x3F});
    }

    @Test
    void blobLengthFollowsDimension() {
        assertThat(converter.convertToDatabaseColumn(new float[128])).hasSize(512);
    }

    @Test
    void rejectsTruncatedBlob() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute(new byte[]{1, 2, 3, 4, 5}))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not a multiple of 4");
    }

    @Test
    void nullPassesThrough() {
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isNull();
    }
}
