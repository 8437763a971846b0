/**
 * 단방향 메시지 채널.
 *
 * <p>Worker와 owner는 가변 상태를 공유하지 않고 아래 채널로만 통신합니다.</p>
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.worker.core.channel.SendPort} - 송신 권한 (fire-and-forget)</li>
 *   <li>{@link com.ryuqq.worker.core.channel.Mailbox} - worker 측 입력 큐 (무제한 FIFO)</li>
 *   <li>{@link com.ryuqq.worker.core.channel.ListeningPort} - owner 측 수신 포트 (relay Executor에서 전달)</li>
 *   <li>{@link com.ryuqq.worker.core.channel.OneShot} - setup handshake용 일회용 채널</li>
 * </ul>
 *
 * <h2>Worker 채널 배치</h2>
 * <pre>
 * owner                                   worker thread
 *   │                                          │
 *   │ ◄──────── OneShot (Mailbox SendPort) ─── │  (시작 시 1회)
 *   │                                          │
 *   │ ── Inbound(Data | Stop) ──► Mailbox ───► │  (입력 + 종료 신호, 같은 FIFO)
 *   │                                          │
 *   │ ◄── 결과 ─────── ListeningPort(output) ── │
 *   │ ◄── ControlSignal ─ ListeningPort(control)│  (종료 신호 미러 전용)
 * </pre>
 *
 * @author Worker Team
 * @since 1.0.0
 */
package com.ryuqq.worker.core.channel;
