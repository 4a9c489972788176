package com.ryuqq.synthesis.application.request;

import com.ryuqq.synthesis.core.model.Resolution;

/**
 * 원격 모델 식별자 설정.
 *
 * <p>고해상도(1080p) 요청은 고품질 모델로 보내야 합니다.
 * 빠른 모델로 1080p를 요청하면 검은 화면이 생성되는 경우가 있습니다.</p>
 *
 * @param highQualityVideoModel 1080p 영상 모델
 * @param fastVideoModel 720p 영상 모델
 * @param imageEditModel 정지 이미지 편집 모델
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ModelSelector(
    String highQualityVideoModel,
    String fastVideoModel,
    String imageEditModel
) {

    public static final String DEFAULT_HIGH_QUALITY_VIDEO_MODEL = "veo-3.1-generate-preview";
    public static final String DEFAULT_FAST_VIDEO_MODEL = "veo-3.1-fast-generate-preview";
    public static final String DEFAULT_IMAGE_EDIT_MODEL = "gemini-2.5-flash-image";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 모델명이 null이거나 빈 문자열인 경우
     */
    public ModelSelector {
        requireModel(highQualityVideoModel, "highQualityVideoModel");
        requireModel(fastVideoModel, "fastVideoModel");
        requireModel(imageEditModel, "imageEditModel");
    }

    /**
     * 기본 모델 구성으로 생성.
     */
    public ModelSelector() {
        this(DEFAULT_HIGH_QUALITY_VIDEO_MODEL, DEFAULT_FAST_VIDEO_MODEL, DEFAULT_IMAGE_EDIT_MODEL);
    }

    /**
     * 해상도에 맞는 영상 모델 선택.
     *
     * @param resolution 요청 해상도
     * @return 1080p면 고품질 모델, 아니면 빠른 모델
     */
    public String videoModelFor(Resolution resolution) {
        if (resolution == null) {
            throw new IllegalArgumentException("resolution cannot be null");
        }
        return resolution.isHighQuality() ? highQualityVideoModel : fastVideoModel;
    }

    public ModelSelector withHighQualityVideoModel(String model) {
        return new ModelSelector(model, fastVideoModel, imageEditModel);
    }

    public ModelSelector withFastVideoModel(String model) {
        return new ModelSelector(highQualityVideoModel, model, imageEditModel);
    }

    public ModelSelector withImageEditModel(String model) {
        return new ModelSelector(highQualityVideoModel, fastVideoModel, model);
    }

    private static void requireModel(String model, String name) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
