/**
 * Worker 묶음 (round-robin fan-out, 병합 fan-in).
 *
 * @author Worker Team
 * @since 1.0.0
 */
package com.ryuqq.worker.pool;
