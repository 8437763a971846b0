package com.ryuqq.worker.core.message;

/**
 * Worker 입력 채널로 전달되는 메시지.
 *
 * <p>입력 채널은 데이터와 종료 신호를 같은 FIFO 큐로 운반합니다.
 * 종료 신호를 별도 타입({@link Stop})으로 표현하므로 호출자가 보낸 어떤 입력도
 * 종료 신호로 오인될 수 없습니다. dispatch loop는 값 비교가 아닌 타입으로만 구분합니다.</p>
 *
 * <p><strong>메시지 종류:</strong></p>
 * <ul>
 *   <li>{@link Data}: 함수에 전달할 입력 값</li>
 *   <li>{@link Stop}: 종료 신호 (이미 큐에 들어간 입력 뒤에 위치)</li>
 * </ul>
 *
 * @param <I> 입력 타입
 * @author Worker Team
 * @since 1.0.0
 */
public sealed interface Inbound<I> permits Inbound.Data, Inbound.Stop {

    /**
     * 데이터 메시지 생성.
     *
     * @param value 입력 값
     * @param <I> 입력 타입
     * @return Data 메시지
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <I> Inbound<I> data(I value) {
        return new Data<>(value);
    }

    /**
     * 종료 신호 생성.
     *
     * @param <I> 입력 타입
     * @return Stop 메시지
     */
    static <I> Inbound<I> stop() {
        return new Stop<>();
    }

    /**
     * 입력 값을 담은 메시지.
     *
     * @param value 입력 값 (null 불가)
     * @param <I> 입력 타입
     */
    record Data<I>(I value) implements Inbound<I> {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException value가 null인 경우
         */
        public Data {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }
    }

    /**
     * 종료 신호.
     *
     * @param <I> 입력 타입
     */
    record Stop<I>() implements Inbound<I> {
    }
}
