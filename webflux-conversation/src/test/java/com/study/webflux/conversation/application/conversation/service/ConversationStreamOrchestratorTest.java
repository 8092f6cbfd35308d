package com.study.webflux.conversation.application.conversation.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import com.study.webflux.conversation.domain.conversation.exception.GenerationInProgressException;
import com.study.webflux.conversation.domain.conversation.model.ChatStreamEvent;
import com.study.webflux.conversation.domain.conversation.model.ConversationHandle;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.GenerationEvent;
import com.study.webflux.conversation.domain.conversation.model.GenerationParameters;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import com.study.webflux.conversation.domain.conversation.service.HistoryTrimmer;
import com.study.webflux.conversation.fixture.InMemoryConversationCache;
import com.study.webflux.conversation.fixture.InMemoryConversationRepository;
import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;
import com.study.webflux.conversation.infrastructure.monitoring.config.ConversationMetricsConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ConversationStreamOrchestratorTest {

	private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");
	private static final ConversationHandle HANDLE = new ConversationHandle(
		ConversationId.of("conv-1"), null, false);
	private static final List<Turn> PROMPT = List.of(Turn.system("prompt"), Turn.user("Hello"));

	private InMemoryConversationCache cache;
	private InMemoryConversationRepository repository;
	private GenerationStateRegistry registry;
	private ConversationProperties properties;
	private SimpleMeterRegistry meterRegistry;
	private ConversationHistoryCoordinator coordinator;
	private AtomicReference<Flux<GenerationEvent>> upstream;
	private AtomicReference<List<Turn>> sentTurns;

	@BeforeEach
	void setUp() {
		cache = new InMemoryConversationCache();
		repository = new InMemoryConversationRepository();
		registry = new GenerationStateRegistry();
		properties = new ConversationProperties();
		meterRegistry = new SimpleMeterRegistry();
		coordinator = new ConversationHistoryCoordinator(cache, repository, new HistoryTrimmer(10),
			Clock.fixed(NOW, ZoneOffset.UTC), properties);
		upstream = new AtomicReference<>(Flux.empty());
		sentTurns = new AtomicReference<>();
		cache.seed(HANDLE.id(), PROMPT);
	}

	private ConversationStreamOrchestrator orchestrator() {
		return new ConversationStreamOrchestrator((turns, parameters) -> {
			sentTurns.set(turns);
			return upstream.get();
		}, coordinator, registry, new GenerationParameters("gpt-4o-mini", 2048, 0.7),
			new ConversationMetricsConfiguration(meterRegistry), properties);
	}

	private double streamCount(String outcome) {
		return meterRegistry.get("conversation.stream.count").tag("outcome", outcome).counter()
			.count();
	}

	@Test
	@DisplayName("델타를 순서대로 전달하고 [DONE] 뒤에 응답을 저장한다")
	void stream_forwardsDeltasThenDoneAndPersists() {
		upstream.set(Flux.just(GenerationEvent.delta("Hi"), GenerationEvent.delta(" there"),
			GenerationEvent.end()));

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectNext(ChatStreamEvent.content("Hi"))
			.expectNext(ChatStreamEvent.content(" there"))
			.expectNext(ChatStreamEvent.done("Hi there"))
			.verifyComplete();

		assertThat(cache.turnsOf(HANDLE.id())).endsWith(Turn.assistant("Hi there"));
		assertThat(repository.get(HANDLE.id()).turns()).endsWith(Turn.assistant("Hi there"));
		assertThat(registry.stateOf(HANDLE.id())).isEqualTo(GenerationStateRegistry.State.IDLE);
		assertThat(streamCount("completed")).isEqualTo(1.0);
	}

	@Test
	@DisplayName("전달한 델타를 이어 붙인 값이 저장된 응답과 같다")
	void stream_completeness() {
		List<String> deltas = List.of("스트", "리밍", " ", "응답", "입니다", ".");
		upstream.set(Flux.fromIterable(deltas).map(GenerationEvent::delta)
			.concatWith(Flux.just(GenerationEvent.end())));

		List<ChatStreamEvent> events = orchestrator().stream(HANDLE, PROMPT).collectList().block();

		String forwarded = events.stream()
			.filter(event -> !event.isDone())
			.map(ChatStreamEvent::content)
			.collect(Collectors.joining());
		Turn last = cache.turnsOf(HANDLE.id()).get(cache.turnsOf(HANDLE.id()).size() - 1);
		assertThat(last).isEqualTo(Turn.assistant(forwarded));
		assertThat(events.get(events.size() - 1).fullResponse()).isEqualTo(forwarded);
	}

	@Test
	@DisplayName("END 없이 스트림이 끝나도 정상 종료로 처리한다")
	void stream_completesWithoutEndEvent() {
		upstream.set(Flux.just(GenerationEvent.delta("answer")));

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectNext(ChatStreamEvent.content("answer"))
			.expectNext(ChatStreamEvent.done("answer"))
			.verifyComplete();
	}

	@Test
	@DisplayName("system 메시지가 없으면 설정된 프롬프트를 앞에 추가해 요청한다")
	void stream_injectsSystemTurn() {
		upstream.set(Flux.just(GenerationEvent.end()));

		orchestrator().stream(HANDLE, List.of(Turn.user("Hello"))).blockLast();

		assertThat(sentTurns.get()).containsExactly(Turn.system(properties.getSystemPrompt()),
			Turn.user("Hello"));
	}

	@Test
	@DisplayName("빈 응답은 저장하지 않는다")
	void stream_emptyResponse_notPersisted() {
		upstream.set(Flux.just(GenerationEvent.end()));

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectNext(ChatStreamEvent.done(""))
			.verifyComplete();

		assertThat(cache.turnsOf(HANDLE.id())).isEqualTo(PROMPT);
	}

	@Test
	@DisplayName("첫 델타 전에 생성이 실패하면 에러 이벤트를 보내고 응답을 저장하지 않는다")
	void stream_failureBeforeDelta_noAssistantTurn() {
		upstream.set(Flux.error(new IllegalStateException("connection refused")));

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectNext(ChatStreamEvent.error("Stream processing error"))
			.verifyComplete();

		assertThat(cache.turnsOf(HANDLE.id())).isEqualTo(PROMPT);
		assertThat(registry.stateOf(HANDLE.id())).isEqualTo(GenerationStateRegistry.State.IDLE);
		assertThat(streamCount("failed")).isEqualTo(1.0);
	}

	@Test
	@DisplayName("생성 중 ERROR 이벤트가 오면 받은 델타 뒤에 에러 이벤트를 보내고 저장하지 않는다")
	void stream_errorEventMidStream_noAssistantTurn() {
		upstream.set(Flux.just(GenerationEvent.delta("부분"), GenerationEvent.error("rate limited"),
			GenerationEvent.delta("무시")));

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectNext(ChatStreamEvent.content("부분"))
			.expectNext(ChatStreamEvent.error("Stream processing error"))
			.verifyComplete();

		assertThat(cache.turnsOf(HANDLE.id())).isEqualTo(PROMPT);
	}

	@Test
	@DisplayName("클라이언트가 연결을 끊으면 생성 구독을 취소하고 받은 텍스트를 저장한다")
	void stream_cancelled_persistsPartialAndCancelsUpstream() {
		AtomicBoolean upstreamCancelled = new AtomicBoolean();
		upstream.set(Flux.just(GenerationEvent.delta("Hel"), GenerationEvent.delta("lo"))
			.concatWith(Flux.never())
			.doOnCancel(() -> upstreamCancelled.set(true)));

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectNext(ChatStreamEvent.content("Hel"))
			.expectNext(ChatStreamEvent.content("lo"))
			.thenCancel()
			.verify();

		assertThat(upstreamCancelled).isTrue();
		assertThat(cache.turnsOf(HANDLE.id())).endsWith(Turn.assistant("Hello"));
		assertThat(registry.stateOf(HANDLE.id())).isEqualTo(GenerationStateRegistry.State.IDLE);
		assertThat(streamCount("cancelled")).isEqualTo(1.0);
	}

	@Test
	@DisplayName("델타를 받기 전에 연결이 끊기면 아무것도 저장하지 않는다")
	void stream_cancelledBeforeDelta_nothingPersisted() {
		upstream.set(Flux.never());

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectSubscription()
			.thenCancel()
			.verify();

		assertThat(cache.turnsOf(HANDLE.id())).isEqualTo(PROMPT);
		assertThat(registry.stateOf(HANDLE.id())).isEqualTo(GenerationStateRegistry.State.IDLE);
	}

	@Test
	@DisplayName("같은 대화에서 생성 중이면 새 스트림은 거부된다")
	void stream_alreadyStreaming_rejected() {
		upstream.set(Flux.just(GenerationEvent.end()));
		registry.tryStart(HANDLE.id());

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectError(GenerationInProgressException.class)
			.verify();

		assertThat(registry.stateOf(HANDLE.id()))
			.isEqualTo(GenerationStateRegistry.State.STREAMING);
	}

	@Test
	@DisplayName("진행 중인 스트림이 끝나면 같은 대화에서 다시 생성할 수 있다")
	void stream_afterCompletion_acceptsNext() {
		upstream.set(Flux.just(GenerationEvent.delta("first"), GenerationEvent.end()));
		ConversationStreamOrchestrator orchestrator = orchestrator();
		orchestrator.stream(HANDLE, PROMPT).blockLast();

		upstream.set(Flux.just(GenerationEvent.delta("second"), GenerationEvent.end()));

		StepVerifier.create(orchestrator.stream(HANDLE, PROMPT))
			.expectNext(ChatStreamEvent.content("second"))
			.expectNext(ChatStreamEvent.done("second"))
			.verifyComplete();
	}

	@Test
	@DisplayName("다른 대화의 스트림은 서로 막지 않는다")
	void stream_differentConversations_independent() {
		ConversationHandle other = new ConversationHandle(ConversationId.of("conv-2"), null, true);
		registry.tryStart(HANDLE.id());
		upstream.set(Flux.just(GenerationEvent.delta("ok"), GenerationEvent.end()));

		StepVerifier.create(orchestrator().stream(other, PROMPT))
			.expectNext(ChatStreamEvent.content("ok"))
			.expectNext(ChatStreamEvent.done("ok"))
			.verifyComplete();
	}

	@Test
	@DisplayName("생성 모델이 응답하지 않으면 idle timeout 후 에러 이벤트를 보낸다")
	void stream_idleTimeout_errorEvent() {
		properties.getStream().setIdleTimeout(Duration.ofMillis(50));
		upstream.set(Flux.never());

		StepVerifier.create(orchestrator().stream(HANDLE, PROMPT))
			.expectNext(ChatStreamEvent.error("Stream processing error"))
			.expectComplete()
			.verify(Duration.ofSeconds(5));

		assertThat(registry.stateOf(HANDLE.id())).isEqualTo(GenerationStateRegistry.State.IDLE);
	}
}
