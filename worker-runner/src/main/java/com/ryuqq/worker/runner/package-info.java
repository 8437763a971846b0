/**
 * 단일 실행 단위 Worker.
 *
 * <p>{@link com.ryuqq.worker.runner.Worker}는 전용 스레드 하나와 owner 측 relay 스레드 하나로
 * 구성되며, 둘은 채널로만 통신합니다. 실행 단위 내부 로직은
 * {@code DispatchLoop}에 있습니다.</p>
 *
 * @author Worker Team
 * @since 1.0.0
 */
package com.ryuqq.worker.runner;
