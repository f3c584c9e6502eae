package com.yerin.submitflow.domain;

import java.time.Instant;

/**
 * 큐에서 받은 메시지 한 건. receiveCount 는 이번 수신을 포함한 누적 전달 횟수.
 */
public record QueueMessage(String id, String body, long receiveCount, Instant enqueuedAt) {
}
