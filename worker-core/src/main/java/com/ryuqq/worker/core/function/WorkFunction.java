package com.ryuqq.worker.core.function;

import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Worker가 실행하는 단일 계산 함수.
 *
 * <p>입력 하나를 받아 결과 하나를 만들어내는 함수이며, 결과가 즉시 준비되는지
 * 나중에 완료되는지에 따라 두 가지 형태로 나뉩니다:</p>
 * <ul>
 *   <li>{@link Immediate}: 호출 즉시 결과 반환 (동기)</li>
 *   <li>{@link Deferred}: {@link CompletionStage}로 결과 반환 (비동기)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 dispatch loop가 두 경우를 빠짐없이 처리하도록 강제합니다.</p>
 *
 * <p><strong>제약:</strong> 함수는 별도 실행 단위에서 호출되므로 호출자와 공유하는
 * 가변 상태를 캡처하거나 의존해서는 안 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * WorkFunction&lt;Integer, Integer&gt; doubler = WorkFunction.of(x -&gt; x * 2);
 *
 * WorkFunction&lt;Path, Long&gt; sizer = WorkFunction.deferred(
 *     path -&gt; CompletableFuture.supplyAsync(() -&gt; Files.size(path))
 * );
 * </pre>
 *
 * @param <I> 입력 타입
 * @param <R> 결과 타입
 * @author Worker Team
 * @since 1.0.0
 */
public sealed interface WorkFunction<I, R> permits WorkFunction.Immediate, WorkFunction.Deferred {

    /**
     * 동기 함수 생성.
     *
     * @param function 입력을 결과로 변환하는 함수
     * @param <I> 입력 타입
     * @param <R> 결과 타입
     * @return Immediate WorkFunction
     * @throws IllegalArgumentException function이 null인 경우
     */
    static <I, R> WorkFunction<I, R> of(Function<? super I, ? extends R> function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        return (Immediate<I, R>) function::apply;
    }

    /**
     * 비동기 함수 생성.
     *
     * @param function 입력을 CompletionStage로 변환하는 함수
     * @param <I> 입력 타입
     * @param <R> 결과 타입
     * @return Deferred WorkFunction
     * @throws IllegalArgumentException function이 null인 경우
     */
    static <I, R> WorkFunction<I, R> deferred(Function<? super I, ? extends CompletionStage<R>> function) {
        if (function == null) {
            throw new IllegalArgumentException("function cannot be null");
        }
        return (Deferred<I, R>) function::apply;
    }

    /**
     * 결과를 즉시 반환하는 함수.
     *
     * @param <I> 입력 타입
     * @param <R> 결과 타입
     */
    @FunctionalInterface
    non-sealed interface Immediate<I, R> extends WorkFunction<I, R> {

        /**
         * 입력 처리.
         *
         * @param input 입력 값
         * @return 결과 값
         */
        R apply(I input);
    }

    /**
     * 결과를 나중에 완료하는 함수.
     *
     * <p>여러 입력의 결과가 겹쳐서 진행될 경우, 결과는 dispatch 순서가 아닌
     * 완료 순서대로 출력됩니다.</p>
     *
     * @param <I> 입력 타입
     * @param <R> 결과 타입
     */
    @FunctionalInterface
    non-sealed interface Deferred<I, R> extends WorkFunction<I, R> {

        /**
         * 입력 처리 시작.
         *
         * @param input 입력 값
         * @return 결과를 완료할 CompletionStage (null 불가)
         */
        CompletionStage<R> apply(I input);
    }
}
