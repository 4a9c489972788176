package com.ryuqq.synthesis.application.request;

import com.ryuqq.synthesis.application.task.ImageRemedyTask;
import com.ryuqq.synthesis.application.task.LogoAnimationTask;
import com.ryuqq.synthesis.application.task.VideoGenerationTask;
import com.ryuqq.synthesis.core.model.AspectRatio;
import com.ryuqq.synthesis.core.model.GenerationRequest;
import com.ryuqq.synthesis.core.model.ImageEditRequest;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.model.MontageSegment;
import com.ryuqq.synthesis.core.model.Resolution;

import java.util.List;

/**
 * 기능 태스크를 원격 요청으로 변환.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RequestFactory {

    private final ModelSelector models;

    /**
     * 기본 모델 구성으로 생성.
     */
    public RequestFactory() {
        this(new ModelSelector());
    }

    /**
     * 생성자.
     *
     * @param models 모델 구성
     */
    public RequestFactory(ModelSelector models) {
        if (models == null) {
            throw new IllegalArgumentException("models cannot be null");
        }
        this.models = models;
    }

    public GenerationRequest videoGeneration(VideoGenerationTask task) {
        return new GenerationRequest(
            models.videoModelFor(task.resolution()),
            PromptTemplates.video(task.prompt(), task.style()),
            null,
            task.aspectRatio(),
            task.resolution()
        );
    }

    /**
     * 로고 애니메이션 요청.
     *
     * <p>원격 서비스는 PNG/JPEG만 받으므로 PNG가 아닌 이미지는 image/jpeg로 전달합니다.</p>
     *
     * @param task 로고 태스크
     * @return 로고 이미지를 포함한 생성 요청
     */
    public GenerationRequest logoAnimation(LogoAnimationTask task) {
        MediaBlob logo = task.logo();
        String mimeType = logo.mimeType().contains("png") ? "image/png" : "image/jpeg";
        return new GenerationRequest(
            models.videoModelFor(task.resolution()),
            PromptTemplates.logo(task.niche(), task.customDirection()),
            new MediaBlob(logo.data(), mimeType),
            task.aspectRatio(),
            task.resolution()
        );
    }

    /**
     * 영상 보정 요청 (720p, 16:9 재구성).
     *
     * @param task 보정 태스크 (영상)
     * @return 생성 요청
     */
    public GenerationRequest videoRemedy(ImageRemedyTask task) {
        if (!task.isVideo()) {
            throw new IllegalArgumentException("video remedy requires video media (current: "
                + task.media().mimeType() + ")");
        }
        return new GenerationRequest(
            models.fastVideoModel(),
            PromptTemplates.videoRemedy(task.prompt()),
            null,
            AspectRatio.LANDSCAPE,
            Resolution.HD
        );
    }

    /**
     * 정지 이미지 편집 요청.
     *
     * @param task 보정 태스크 (이미지)
     * @return 편집 요청
     */
    public ImageEditRequest imageEdit(ImageRemedyTask task) {
        if (task.isVideo()) {
            throw new IllegalArgumentException("image edit requires still image media");
        }
        return new ImageEditRequest(
            models.imageEditModel(),
            task.media(),
            PromptTemplates.imageEdit(task.mode(), task.prompt())
        );
    }

    /**
     * 몽타주 렌더링 요청.
     *
     * @param segments 분석된 하이라이트 구간 (1개 이상)
     * @return 생성 요청
     */
    public GenerationRequest montageRender(List<MontageSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("segments cannot be null or empty");
        }
        return new GenerationRequest(
            models.fastVideoModel(),
            PromptTemplates.montage(segments),
            null,
            AspectRatio.LANDSCAPE,
            Resolution.HD
        );
    }

    public ModelSelector getModels() {
        return models;
    }
}
