/**
 * 채널 메시지 모델.
 *
 * <p>{@link com.ryuqq.worker.core.message.Inbound}는 입력 채널,
 * {@link com.ryuqq.worker.core.message.ControlSignal}은 제어 채널 전용입니다.</p>
 *
 * @author Worker Team
 * @since 1.0.0
 */
package com.ryuqq.worker.core.message;
