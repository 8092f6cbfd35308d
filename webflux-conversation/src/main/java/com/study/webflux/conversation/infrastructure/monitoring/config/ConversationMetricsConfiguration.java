package com.study.webflux.conversation.infrastructure.monitoring.config;

import org.springframework.stereotype.Component;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 대화 스트리밍 관련 메트릭을 제공합니다.
 *
 * <p>
 * 스트림 시작/완료/취소/실패 횟수, 응답 길이 분포, 대화 초기화 횟수를 기록합니다.
 */
@Component
public class ConversationMetricsConfiguration {

	private final Counter streamStartedCounter;
	private final Counter streamCompletedCounter;
	private final Counter streamCancelledCounter;
	private final Counter streamFailedCounter;
	private final Counter conversationResetCounter;

	private final DistributionSummary responseLengthSummary;

	public ConversationMetricsConfiguration(MeterRegistry meterRegistry) {
		this.streamStartedCounter = streamCounter(meterRegistry, "started");
		this.streamCompletedCounter = streamCounter(meterRegistry, "completed");
		this.streamCancelledCounter = streamCounter(meterRegistry, "cancelled");
		this.streamFailedCounter = streamCounter(meterRegistry, "failed");

		this.conversationResetCounter = Counter.builder("conversation.reset.count")
			.description("Number of times a conversation was reset")
			.register(meterRegistry);

		this.responseLengthSummary = DistributionSummary.builder("conversation.response.length")
			.description("Distribution of assistant response lengths in characters")
			.publishPercentiles(0.5, 0.75, 0.9, 0.95, 0.99)
			.register(meterRegistry);
	}

	private static Counter streamCounter(MeterRegistry meterRegistry, String outcome) {
		return Counter.builder("conversation.stream.count")
			.tag("outcome", outcome)
			.description("Number of response streams by outcome")
			.register(meterRegistry);
	}

	public void recordStreamStarted() {
		streamStartedCounter.increment();
	}

	public void recordStreamCompleted(int responseLength) {
		streamCompletedCounter.increment();
		responseLengthSummary.record(responseLength);
	}

	/**
	 * 클라이언트 연결 종료로 중단된 스트림을 기록합니다.
	 */
	public void recordStreamCancelled() {
		streamCancelledCounter.increment();
	}

	public void recordStreamFailed() {
		streamFailedCounter.increment();
	}

	public void recordConversationReset() {
		conversationResetCounter.increment();
	}
}
