package com.ryuqq.synthesis.core.model;

/**
 * 원격 Long-running Operation의 식별자.
 *
 * <p>원격 서비스가 제출 응답으로 돌려준 핸들을 그대로 보관합니다
 * (예: {@code models/veo-3.1-generate-preview/operations/abc123}).
 * 클라이언트는 이 값을 해석하지 않으며, 폴링 호출에 그대로 전달합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~512자</li>
 *   <li>공백 문자 포함 불가</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class OpId {

    private static final int MAX_LENGTH = 512;

    private final String value;

    private OpId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OpId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("OpId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("OpId cannot contain whitespace");
        }
        this.value = value;
    }

    /**
     * OpId 생성.
     *
     * @param value 원격 Operation 핸들
     * @return OpId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OpId of(String value) {
        return new OpId(value);
    }

    /**
     * OpId 값 조회.
     *
     * @return 원격 Operation 핸들
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OpId opId = (OpId) o;
        return value.equals(opId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OpId{" + value + '}';
    }
}
