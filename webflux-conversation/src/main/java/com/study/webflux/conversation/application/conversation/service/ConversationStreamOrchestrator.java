package com.study.webflux.conversation.application.conversation.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.conversation.domain.conversation.exception.GenerationFailedException;
import com.study.webflux.conversation.domain.conversation.exception.GenerationInProgressException;
import com.study.webflux.conversation.domain.conversation.model.ChatStreamEvent;
import com.study.webflux.conversation.domain.conversation.model.ConversationHandle;
import com.study.webflux.conversation.domain.conversation.model.GenerationEvent;
import com.study.webflux.conversation.domain.conversation.model.GenerationParameters;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import com.study.webflux.conversation.domain.conversation.port.GenerationPort;
import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;
import com.study.webflux.conversation.infrastructure.monitoring.config.ConversationMetricsConfiguration;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;

/**
 * 생성 모델의 스트림을 클라이언트 이벤트로 전달하고 완성된 응답을 대화 기록에 넘깁니다.
 *
 * <p>
 * 델타는 도착 순서대로 즉시 전달되며, 종료 시 전체 응답을 담은 [DONE] 이벤트를 보낸 뒤 응답을 저장합니다. 클라이언트가 연결을 끊으면 생성 구독을
 * 취소하고 그때까지 받은 텍스트를 저장합니다. 생성이 실패하면 에러 이벤트를 보내고 응답은 저장하지 않습니다.
 */
@Slf4j
@Service
public class ConversationStreamOrchestrator {

	static final String STREAM_ERROR_MESSAGE = "Stream processing error";

	private final GenerationPort generationPort;
	private final ConversationHistoryCoordinator historyCoordinator;
	private final GenerationStateRegistry stateRegistry;
	private final GenerationParameters generationParameters;
	private final ConversationMetricsConfiguration metrics;
	private final String systemPrompt;
	private final Duration idleTimeout;

	public ConversationStreamOrchestrator(GenerationPort generationPort,
		ConversationHistoryCoordinator historyCoordinator,
		GenerationStateRegistry stateRegistry,
		GenerationParameters generationParameters,
		ConversationMetricsConfiguration metrics,
		ConversationProperties properties) {
		this.generationPort = generationPort;
		this.historyCoordinator = historyCoordinator;
		this.stateRegistry = stateRegistry;
		this.generationParameters = generationParameters;
		this.metrics = metrics;
		this.systemPrompt = properties.getSystemPrompt();
		this.idleTimeout = properties.getStream().getIdleTimeout();
	}

	/**
	 * 대화의 응답을 생성합니다. 같은 대화에서 생성이 진행 중이면 {@link GenerationInProgressException}으로 실패합니다.
	 */
	public Flux<ChatStreamEvent> stream(ConversationHandle handle, List<Turn> turns) {
		return Flux.defer(() -> {
			if (!stateRegistry.tryStart(handle.id())) {
				log.warn("이미 응답을 생성 중인 대화입니다: conversationId={}", handle.id());
				return Flux.error(new GenerationInProgressException(handle.id()));
			}
			metrics.recordStreamStarted();
			log.info("응답 스트리밍 시작: conversationId={}, turns={}", handle.id(), turns.size());
			return new GenerationRun(handle).events(withSystemTurn(turns));
		});
	}

	private List<Turn> withSystemTurn(List<Turn> turns) {
		if (turns.stream().anyMatch(Turn::isSystem)) {
			return turns;
		}
		List<Turn> prompt = new ArrayList<>(turns.size() + 1);
		prompt.add(Turn.system(systemPrompt));
		prompt.addAll(turns);
		return prompt;
	}

	/** 한 번의 생성 호출에 대한 누적 텍스트와 저장 상태를 보관합니다. */
	private final class GenerationRun {

		private final ConversationHandle handle;
		private final StringBuilder accumulator = new StringBuilder();
		private final AtomicBoolean handedOff = new AtomicBoolean();
		private volatile CompletableFuture<Void> handOff;

		private GenerationRun(ConversationHandle handle) {
			this.handle = handle;
		}

		Flux<ChatStreamEvent> events(List<Turn> prompt) {
			Flux<GenerationEvent> upstream = Flux
				.defer(() -> generationPort.stream(prompt, generationParameters));
			if (!idleTimeout.isZero() && !idleTimeout.isNegative()) {
				upstream = upstream.timeout(idleTimeout);
			}

			return upstream
				.takeUntil(GenerationEvent::isTerminal)
				.<ChatStreamEvent>handle(this::forward)
				.concatWith(Mono.fromSupplier(this::completed))
				.concatWith(Mono.defer(this::handOffCompleted).then(Mono.<ChatStreamEvent>empty()))
				.onErrorResume(this::failed)
				.doOnCancel(this::cancelled)
				.doOnComplete(this::release);
		}

		private void forward(GenerationEvent event, SynchronousSink<ChatStreamEvent> sink) {
			switch (event.type()) {
				case DELTA -> {
					String text = event.text();
					if (text != null && !text.isEmpty()) {
						append(text);
						sink.next(ChatStreamEvent.content(text));
					}
				}
				case ERROR -> sink.error(new GenerationFailedException(
					event.detail() == null ? "generation failed" : event.detail()));
				case END -> {
				}
			}
		}

		private ChatStreamEvent completed() {
			String fullResponse = accumulated();
			metrics.recordStreamCompleted(fullResponse.length());
			log.info("응답 스트리밍 완료: conversationId={}, length={}", handle.id(),
				fullResponse.length());
			return ChatStreamEvent.done(fullResponse);
		}

		private Mono<Void> handOffCompleted() {
			return Mono.fromFuture(startHandOff(accumulated()), true);
		}

		private Flux<ChatStreamEvent> failed(Throwable error) {
			abandon();
			metrics.recordStreamFailed();
			log.error("응답 생성 실패: conversationId={}, error={}", handle.id(), error.getMessage());
			return Flux.just(ChatStreamEvent.error(STREAM_ERROR_MESSAGE));
		}

		private void cancelled() {
			metrics.recordStreamCancelled();
			String partial = accumulated();
			log.info("클라이언트 연결 종료로 생성을 취소합니다: conversationId={}, partialLength={}",
				handle.id(),
				partial.length());
			startHandOff(partial).whenComplete((ignored, error) -> release());
		}

		private void release() {
			stateRegistry.release(handle.id());
		}

		private synchronized CompletableFuture<Void> startHandOff(String text) {
			if (handedOff.compareAndSet(false, true)) {
				handOff = text.isEmpty()
					? CompletableFuture.completedFuture(null)
					: historyCoordinator.appendAssistantTurn(handle, text)
						.then()
						.onErrorResume(error -> {
							log.warn("응답 저장 실패: conversationId={}, error={}", handle.id(),
								error.getMessage());
							return Mono.empty();
						})
						.toFuture();
			}
			return handOff;
		}

		private synchronized void abandon() {
			if (handedOff.compareAndSet(false, true)) {
				handOff = CompletableFuture.completedFuture(null);
			}
		}

		private synchronized void append(String text) {
			accumulator.append(text);
		}

		private synchronized String accumulated() {
			return accumulator.toString();
		}
	}
}
