package com.ryuqq.synthesis.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MediaBlob 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class MediaBlobTest {

    @Test
    void data_방어적_복사() {
        byte[] source = {1, 2, 3};
        MediaBlob blob = new MediaBlob(source, "video/mp4");

        source[0] = 9;
        blob.data()[1] = 9;

        assertThat(blob.data()).containsExactly(new byte[]{1, 2, 3});
    }

    @Test
    void equals_내용_기준_비교() {
        assertThat(new MediaBlob(new byte[]{1}, "image/png"))
            .isEqualTo(new MediaBlob(new byte[]{1}, "image/png"))
            .isNotEqualTo(new MediaBlob(new byte[]{1}, "image/jpeg"));
    }

    @Test
    void isVideo_mimeType으로_판단() {
        assertThat(new MediaBlob(new byte[0], "video/mp4").isVideo()).isTrue();
        assertThat(new MediaBlob(new byte[0], "image/png").isVideo()).isFalse();
    }
}
