package com.ryuqq.worker.core.message;

/**
 * 제어 채널 신호 (worker 측 → owner 측).
 *
 * <p>제어 채널은 결과 채널과 분리되어 있으며, 입력 값이나 결과 값을 절대 운반하지 않습니다.
 * 덕분에 owner 측 결과 전달 경로는 결과마다 종료 신호 여부를 검사할 필요가 없습니다.</p>
 *
 * <ul>
 *   <li>{@link Stopped}: 종료 신호를 되돌려 보냄 (이전 입력이 모두 처리된 후)</li>
 *   <li>{@link Faulted}: 함수 실행 중 오류가 발생하여 실행 단위가 중단됨</li>
 * </ul>
 *
 * @author Worker Team
 * @since 1.0.0
 */
public sealed interface ControlSignal permits ControlSignal.Stopped, ControlSignal.Faulted {

    /**
     * 종료 신호 미러.
     */
    record Stopped() implements ControlSignal {
    }

    /**
     * 함수 오류 신호.
     *
     * @param cause 함수가 던진 오류 (null 불가)
     */
    record Faulted(Throwable cause) implements ControlSignal {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException cause가 null인 경우
         */
        public Faulted {
            if (cause == null) {
                throw new IllegalArgumentException("cause cannot be null");
            }
        }
    }
}
