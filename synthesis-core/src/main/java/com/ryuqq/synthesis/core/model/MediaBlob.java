package com.ryuqq.synthesis.core.model;

import java.util.Arrays;

/**
 * 미디어 바이트와 타입.
 *
 * <p>입력 이미지/클립과 다운로드한 결과물 모두 이 타입으로 전달됩니다.
 * 배열은 생성 시와 조회 시 모두 복사됩니다.</p>
 *
 * @param data 미디어 바이트
 * @param mimeType 미디어 타입 (예: image/png, video/mp4)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record MediaBlob(
    byte[] data,
    String mimeType
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException data가 null이거나 mimeType이 null/blank인 경우
     */
    public MediaBlob {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (mimeType == null || mimeType.isBlank()) {
            throw new IllegalArgumentException("mimeType cannot be null or blank");
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    /**
     * 바이트 길이 조회.
     *
     * @return 바이트 길이
     */
    public int size() {
        return data.length;
    }

    /**
     * 동영상 여부.
     *
     * @return mimeType이 video/로 시작하면 true
     */
    public boolean isVideo() {
        return mimeType.startsWith("video/");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MediaBlob other)) return false;
        return mimeType.equals(other.mimeType) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * mimeType.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "MediaBlob{mimeType=" + mimeType + ", size=" + data.length + "}";
    }
}
