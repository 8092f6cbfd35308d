package com.study.webflux.conversation.application.conversation.service;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.conversation.domain.conversation.exception.ConversationNotFoundException;
import com.study.webflux.conversation.domain.conversation.exception.GenerationInProgressException;
import com.study.webflux.conversation.domain.conversation.exception.InvalidMessageException;
import com.study.webflux.conversation.domain.conversation.model.ActiveConversation;
import com.study.webflux.conversation.domain.conversation.model.ChatStreamEvent;
import com.study.webflux.conversation.domain.conversation.model.ConversationHandle;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.ConversationView;
import com.study.webflux.conversation.domain.conversation.model.HistoryEntry;
import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import com.study.webflux.conversation.domain.conversation.port.ClientSession;
import com.study.webflux.conversation.domain.conversation.port.ConversationChatUseCase;
import com.study.webflux.conversation.domain.conversation.service.HistoryTrimmer;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@Service
public class ConversationChatService implements ConversationChatUseCase {

	static final String MISSING_CONVERSATION = "Missing conversation ID";
	static final String NO_HISTORY = "No chat history found";
	static final String NO_USER_MESSAGE = "No user message found";

	private final SessionBinderService sessionBinder;
	private final ConversationHistoryCoordinator historyCoordinator;
	private final ConversationStreamOrchestrator streamOrchestrator;
	private final ConversationHistoryQueryService historyQueryService;
	private final HistoryTrimmer historyTrimmer;

	public ConversationChatService(SessionBinderService sessionBinder,
		ConversationHistoryCoordinator historyCoordinator,
		ConversationStreamOrchestrator streamOrchestrator,
		ConversationHistoryQueryService historyQueryService,
		HistoryTrimmer historyTrimmer) {
		this.sessionBinder = sessionBinder;
		this.historyCoordinator = historyCoordinator;
		this.streamOrchestrator = streamOrchestrator;
		this.historyQueryService = historyQueryService;
		this.historyTrimmer = historyTrimmer;
	}

	@Override
	public Mono<ConversationId> submitMessage(ClientSession session, OwnerId owner, String message,
		boolean temporary) {
		if (message == null || message.isBlank()) {
			return Mono.error(new InvalidMessageException("Message cannot be empty"));
		}
		return sessionBinder.resolveActive(session, owner, temporary)
			.flatMap(handle -> historyCoordinator.appendUserTurn(handle, message));
	}

	@Override
	public Flux<ChatStreamEvent> streamResponse(ClientSession session, OwnerId owner) {
		return Flux.defer(() -> {
			Optional<ActiveConversation> active = session.activeConversation();
			if (active.isEmpty()) {
				log.warn("스트리밍 요청에 바인딩된 대화가 없습니다: sessionId={}", session.id());
				return Flux.just(ChatStreamEvent.error(MISSING_CONVERSATION));
			}
			ConversationHandle handle = active.get().toHandle(owner);
			return historyCoordinator.currentTurns(handle.id())
				.flatMapMany(turns -> streamTurns(handle, turns));
		}).onErrorResume(error -> {
			log.warn("스트리밍을 시작할 수 없습니다: sessionId={}, error={}", session.id(),
				error.getMessage());
			return Flux.just(ChatStreamEvent.error(streamErrorMessage(error)));
		});
	}

	@Override
	public Mono<ConversationView> getConversation(ClientSession session, OwnerId owner,
		ConversationId conversationId) {
		return historyCoordinator.load(conversationId, owner)
			.filter(conversation -> !conversation.temporary() || isBoundTo(session, conversationId))
			.switchIfEmpty(Mono.error(() -> new ConversationNotFoundException(conversationId)))
			.flatMap(conversation -> sessionBinder
				.bind(session, conversationId, conversation.temporary())
				.thenReturn(ConversationView.of(conversationId, conversation.turns())));
	}

	@Override
	public Mono<ConversationId> reset(ClientSession session, OwnerId owner, boolean wasTemporary) {
		return sessionBinder.reset(session, owner, wasTemporary);
	}

	@Override
	public Mono<Map<String, List<HistoryEntry>>> listHistory(ClientSession session, OwnerId owner) {
		ConversationId activeId = session.activeConversation()
			.filter(active -> !active.temporary())
			.map(ActiveConversation::id)
			.orElse(null);
		return historyQueryService.listFor(owner, activeId);
	}

	private Flux<ChatStreamEvent> streamTurns(ConversationHandle handle, List<Turn> turns) {
		if (turns.isEmpty()) {
			log.warn("대화 기록이 없습니다: conversationId={}", handle.id());
			return Flux.just(ChatStreamEvent.error(NO_HISTORY));
		}
		if (turns.stream().noneMatch(Turn::isUser)) {
			log.warn("사용자 메시지가 없습니다: conversationId={}", handle.id());
			return Flux.just(ChatStreamEvent.error(NO_USER_MESSAGE));
		}
		return streamOrchestrator.stream(handle, historyTrimmer.trim(turns));
	}

	/** 소유자 정보가 없는 임시 대화는 해당 대화가 바인딩된 세션에서만 조회할 수 있습니다. */
	private static boolean isBoundTo(ClientSession session, ConversationId conversationId) {
		return session.activeConversation()
			.map(active -> active.id().equals(conversationId))
			.orElse(false);
	}

	private static String streamErrorMessage(Throwable error) {
		if (error instanceof GenerationInProgressException) {
			return error.getMessage();
		}
		return ConversationStreamOrchestrator.STREAM_ERROR_MESSAGE;
	}
}
