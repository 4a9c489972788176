package com.ryuqq.synthesis.application.request;

import com.ryuqq.synthesis.application.task.RemedyMode;
import com.ryuqq.synthesis.application.task.VideoStyle;
import com.ryuqq.synthesis.core.model.MontageSegment;

import java.util.List;

/**
 * 기능별 프롬프트 템플릿.
 *
 * <p>모든 영상 프롬프트는 5초 길이를 요구합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PromptTemplates {

    static final String DEFAULT_REMEDY_DIRECTIVE = "clean removal";
    static final String DEFAULT_AUTO_DIRECTIVE = "professional polish";

    private PromptTemplates() {
        throw new AssertionError("Utility class");
    }

    /**
     * 텍스트 영상 생성 프롬프트.
     *
     * @param subject 사용자 프롬프트
     * @param style 스타일
     * @return 최종 프롬프트
     */
    public static String video(String subject, VideoStyle style) {
        return "CRITICAL PRODUCTION DIRECTIVE:\n"
            + "THE RESULTING VIDEO MUST BE EXACTLY 5 SECONDS LONG.\n"
            + "Style: " + style.label() + ".\n"
            + "Subject: " + subject.trim() + ".";
    }

    /**
     * 로고 애니메이션 프롬프트.
     *
     * @param niche 업종/분야
     * @param customDirection 추가 연출 지시
     * @return 최종 프롬프트
     */
    public static String logo(String niche, String customDirection) {
        return "STRICT LOGO INTEGRITY DIRECTIVE:\n"
            + "- THE PROVIDED IMAGE IS THE LOGO. IT IS SACRED.\n"
            + "- USE THE LOGO EXACTLY AS IT APPEARS. DO NOT REDESIGN, RECOLOR, OR DISTORT ITS FORM.\n"
            + "- THE TASK IS A CINEMATIC REVEAL ANIMATION FOR THIS SPECIFIC LOGO.\n"
            + "- DURATION: EXACTLY 5 SECONDS.\n"
            + "- NICHE: " + niche + ".\n"
            + "- DIRECTION: " + customDirection;
    }

    /**
     * 영상 보정(재구성) 프롬프트.
     *
     * @param prompt 사용자 지시 (null/blank 가능)
     * @return 최종 프롬프트
     */
    public static String videoRemedy(String prompt) {
        return "CINEMATIC REMEDY TASK: " + orDefault(prompt, DEFAULT_REMEDY_DIRECTIVE)
            + ". Reconstruct sequence with full visual integrity, removing unwanted elements.";
    }

    /**
     * 정지 이미지 편집 지시문.
     *
     * @param mode 보정 모드
     * @param prompt 사용자 지시 (null/blank 가능)
     * @return 편집 지시문
     */
    public static String imageEdit(RemedyMode mode, String prompt) {
        if (mode == RemedyMode.REMEDY) {
            return "Task: Remove watermark/logo/unwanted objects as specified. Directive: "
                + orDefault(prompt, DEFAULT_REMEDY_DIRECTIVE) + ". Return the edited image.";
        }
        return "Task: Auto-enhance, sharpen, and clear the image. Directive: "
            + orDefault(prompt, DEFAULT_AUTO_DIRECTIVE) + ". Return the edited image.";
    }

    /**
     * 하이라이트 구간을 이어 붙이는 몽타주 렌더링 프롬프트.
     *
     * @param segments 하이라이트 구간 (1개 이상)
     * @return 최종 프롬프트
     */
    public static String montage(List<MontageSegment> segments) {
        StringBuilder sb = new StringBuilder()
            .append("CINEMATIC MONTAGE DIRECTIVE:\n")
            .append("THE RESULTING VIDEO MUST BE EXACTLY 5 SECONDS LONG.\n")
            .append("Grade and sequence the following highlights into one continuous cut:\n");
        for (int i = 0; i < segments.size(); i++) {
            MontageSegment segment = segments.get(i);
            sb.append(i + 1).append(". [")
                .append(segment.startTimestamp()).append(" - ").append(segment.endTimestamp())
                .append("] ").append(segment.visualDescription()).append('\n');
        }
        return sb.toString().trim();
    }

    private static String orDefault(String prompt, String fallback) {
        return prompt == null || prompt.isBlank() ? fallback : prompt.trim();
    }
}
