package com.ryuqq.synthesis.core.spi;

import com.ryuqq.synthesis.core.cancel.CancellationToken;
import com.ryuqq.synthesis.core.model.GenerationRequest;
import com.ryuqq.synthesis.core.model.ImageEditRequest;
import com.ryuqq.synthesis.core.model.MediaBlob;
import com.ryuqq.synthesis.core.model.MontageSegment;
import com.ryuqq.synthesis.core.model.Operation;

import java.util.List;

/**
 * 원격 미디어 합성 서비스 SPI.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>모든 호출은 토큰을 받아 전송 계층이 진행 중인 요청을 abort할 수 있게 합니다.</li>
 *   <li>실패는 {@link com.ryuqq.synthesis.core.error.SynthesisException}으로 표현합니다.
 *       429 응답은 httpStatus=429로 전달해야 재시도 분류가 동작합니다.</li>
 *   <li>abort로 중단된 호출은 {@link com.ryuqq.synthesis.core.cancel.CancelledException}을 던집니다.</li>
 *   <li>구현체는 thread-safe해야 합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface SynthesisClient {

    /**
     * 영상 생성 요청 제출.
     *
     * @param request 생성 요청
     * @param token 취소 토큰
     * @return 원격 Operation 핸들
     */
    Operation submit(GenerationRequest request, CancellationToken token);

    /**
     * Operation 최신 상태 조회.
     *
     * @param operation 이전에 관찰한 Operation
     * @param token 취소 토큰
     * @return 갱신된 Operation
     */
    Operation poll(Operation operation, CancellationToken token);

    /**
     * 정지 이미지 편집 (동기).
     *
     * @param request 편집 요청
     * @param token 취소 토큰
     * @return 편집된 이미지
     */
    MediaBlob editImage(ImageEditRequest request, CancellationToken token);

    /**
     * 몽타주용 하이라이트 구간 분석 (동기).
     *
     * @param clips 분석할 클립
     * @param token 취소 토큰
     * @return 하이라이트 구간 (분석 결과를 해석할 수 없으면 빈 리스트)
     */
    List<MontageSegment> analyzeMontage(List<MediaBlob> clips, CancellationToken token);
}
