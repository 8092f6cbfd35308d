package com.study.webflux.conversation.application.conversation.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.conversation.domain.conversation.exception.ConversationAccessDeniedException;
import com.study.webflux.conversation.domain.conversation.exception.ConversationNotFoundException;
import com.study.webflux.conversation.domain.conversation.exception.ConversationPersistenceException;
import com.study.webflux.conversation.domain.conversation.exception.InvalidMessageException;
import com.study.webflux.conversation.domain.conversation.model.Conversation;
import com.study.webflux.conversation.domain.conversation.model.ConversationHandle;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import com.study.webflux.conversation.domain.conversation.port.ConversationCachePort;
import com.study.webflux.conversation.domain.conversation.port.ConversationRepository;
import com.study.webflux.conversation.domain.conversation.service.HistoryTrimmer;
import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;
import reactor.core.publisher.Mono;

/**
 * 캐시와 영속 저장소에 대한 모든 쓰기를 담당합니다.
 *
 * <p>
 * 진행 중인 대화는 캐시가 기준이며, 캐시가 비어 있으면 영속 저장소의 기록으로 다시 채웁니다. 영속 저장소 쓰기 실패는 로그만 남기고 클라이언트 응답을
 * 중단시키지 않습니다. 임시 대화는 영속 저장소에 기록하지 않습니다.
 */
@Slf4j
@Service
public class ConversationHistoryCoordinator {

	private final ConversationCachePort cachePort;
	private final ConversationRepository conversationRepository;
	private final HistoryTrimmer historyTrimmer;
	private final Clock clock;
	private final String systemPrompt;

	public ConversationHistoryCoordinator(ConversationCachePort cachePort,
		ConversationRepository conversationRepository,
		HistoryTrimmer historyTrimmer,
		Clock clock,
		ConversationProperties properties) {
		this.cachePort = cachePort;
		this.conversationRepository = conversationRepository;
		this.historyTrimmer = historyTrimmer;
		this.clock = clock;
		this.systemPrompt = properties.getSystemPrompt();
	}

	/**
	 * 사용자 메시지를 추가합니다. 마지막 메시지와 같은 내용의 재전송은 무시합니다.
	 */
	public Mono<ConversationId> appendUserTurn(ConversationHandle handle, String text) {
		if (text == null || text.isBlank()) {
			return Mono.error(new InvalidMessageException("Message cannot be empty"));
		}
		String content = text.trim();
		ConversationId conversationId = handle.id();

		return workingTurns(conversationId).flatMap(turns -> {
			if (isRepeatedUserTurn(turns, content)) {
				log.debug("중복된 사용자 메시지를 무시합니다: conversationId={}", conversationId);
				return Mono.just(conversationId);
			}
			List<Turn> updated = append(turns, Turn.user(content));
			Mono<Void> durable = handle.temporary()
				? Mono.empty()
				: Mono.defer(() -> createIfAbsent(handle, updated));
			return cachePort.put(conversationId, updated)
				.then(durable)
				.thenReturn(conversationId);
		});
	}

	/**
	 * 생성된 응답을 추가하고 길이를 제한한 뒤 캐시와 영속 저장소에 반영합니다.
	 *
	 * @return 제한이 적용된 메시지 목록
	 */
	public Mono<List<Turn>> appendAssistantTurn(ConversationHandle handle, String text) {
		ConversationId conversationId = handle.id();
		return workingTurns(conversationId).flatMap(turns -> {
			List<Turn> trimmed = historyTrimmer.trim(append(turns, Turn.assistant(text)));
			Mono<Void> durable = handle.temporary()
				? Mono.empty()
				: Mono.defer(() -> saveTurns(handle, trimmed));
			return cachePort.put(conversationId, trimmed)
				.then(durable)
				.thenReturn(trimmed);
		});
	}

	/**
	 * 대화를 종료합니다. 실제 메시지가 있는 영구 대화는 endedAt과 함께 저장되고, 캐시 항목은 저장 결과와 관계없이 삭제됩니다.
	 */
	public Mono<Void> finalizeConversation(ConversationHandle handle) {
		ConversationId conversationId = handle.id();
		Mono<Void> persist = storedTurns(conversationId).flatMap(turns -> {
			if (handle.temporary() || turns.stream().noneMatch(Turn::isExchange)) {
				return Mono.<Void>empty();
			}
			return saveEnded(handle, turns);
		});

		return persist.then(Mono.defer(() -> cachePort.delete(conversationId)));
	}

	/** 영구 대화를 시작할 때 빈 기록을 미리 만들어 둡니다. */
	public Mono<Void> createEmptyRecord(ConversationHandle handle) {
		if (handle.temporary()) {
			return Mono.empty();
		}
		return conversationRepository.upsert(Conversation.start(handle, List.of(), clock.instant()))
			.then()
			.onErrorResume(error -> logPersistenceFailure(handle.id(), "create", error));
	}

	/**
	 * 요청자 권한을 확인하며 대화를 조회합니다. 캐시에 없으면 영속 저장소에서 읽어 캐시를 다시 채웁니다.
	 *
	 * <p>
	 * 영속 저장소에 기록이 없는 것이 확인된 캐시 전용 대화만 temporary 대화로 반환됩니다. 영속 저장소 조회가 실패하면 대화 모드를 판단할 수 없으므로
	 * {@link ConversationPersistenceException}으로 실패합니다.
	 */
	public Mono<Conversation> load(ConversationId conversationId, OwnerId requester) {
		return cachePort.get(conversationId).flatMap(cached -> {
			if (cached.isEmpty()) {
				return loadFromRepository(conversationId, requester);
			}
			return conversationRepository.findById(conversationId, requester)
				.onErrorMap(error -> !(error instanceof ConversationAccessDeniedException),
					error -> new ConversationPersistenceException(conversationId, "load", error))
				.map(stored -> stored.withTurns(cached, stored.updatedAt()))
				.defaultIfEmpty(new Conversation(conversationId, null, cached, null, null, null,
					true));
		});
	}

	/** 스트리밍에 사용할 현재 메시지 목록입니다. 기록이 없으면 빈 목록입니다. */
	public Mono<List<Turn>> currentTurns(ConversationId conversationId) {
		return storedTurns(conversationId);
	}

	private Mono<Conversation> loadFromRepository(ConversationId conversationId,
		OwnerId requester) {
		return conversationRepository.findById(conversationId, requester)
			.switchIfEmpty(Mono.error(new ConversationNotFoundException(conversationId)))
			.flatMap(stored -> cachePort.put(conversationId, stored.turns())
				.doOnSuccess(v -> log.debug("영속 기록으로 캐시를 다시 채웠습니다: conversationId={}",
					conversationId))
				.thenReturn(stored));
	}

	private Mono<List<Turn>> storedTurns(ConversationId conversationId) {
		return cachePort.get(conversationId).flatMap(cached -> {
			if (!cached.isEmpty()) {
				return Mono.just(cached);
			}
			return conversationRepository.findById(conversationId)
				.map(Conversation::turns)
				.onErrorResume(error -> {
					log.warn("영속 저장소 조회 실패: conversationId={}, error={}", conversationId,
						error.getMessage());
					return Mono.empty();
				})
				.defaultIfEmpty(List.of());
		});
	}

	private Mono<List<Turn>> workingTurns(ConversationId conversationId) {
		return storedTurns(conversationId)
			.map(turns -> turns.isEmpty() ? List.of(Turn.system(systemPrompt)) : turns);
	}

	private Mono<Void> saveEnded(ConversationHandle handle, List<Turn> turns) {
		ConversationId conversationId = handle.id();
		Instant now = clock.instant();
		return conversationRepository.findById(conversationId)
			.map(existing -> existing.withTurns(turns, now).end(now))
			.switchIfEmpty(Mono.fromSupplier(() -> Conversation.start(handle, turns, now).end(now)))
			.flatMap(conversationRepository::upsert)
			.doOnNext(saved -> log.info("대화 종료 저장: conversationId={}, turns={}", conversationId,
				saved.turns().size()))
			.then()
			.onErrorResume(error -> logPersistenceFailure(conversationId, "finalize", error));
	}

	private Mono<Void> createIfAbsent(ConversationHandle handle, List<Turn> turns) {
		return conversationRepository.findById(handle.id())
			.hasElement()
			.flatMap(exists -> exists
				? Mono.<Void>empty()
				: conversationRepository.upsert(Conversation.start(handle, turns, clock.instant()))
					.doOnNext(created -> log.info("새 대화 기록 생성: conversationId={}, owner={}",
						handle.id(),
						OwnerId.valueOf(handle.ownerId())))
					.then())
			.onErrorResume(error -> logPersistenceFailure(handle.id(), "create", error));
	}

	private Mono<Void> saveTurns(ConversationHandle handle, List<Turn> turns) {
		Instant now = clock.instant();
		return conversationRepository.findById(handle.id())
			.map(existing -> existing.withTurns(turns, now))
			.switchIfEmpty(Mono.fromSupplier(() -> Conversation.start(handle, turns, now)))
			.flatMap(conversationRepository::upsert)
			.then()
			.onErrorResume(error -> logPersistenceFailure(handle.id(), "update", error));
	}

	private Mono<Void> logPersistenceFailure(ConversationId conversationId, String operation,
		Throwable error) {
		log.warn("대화 저장 실패, 응답은 계속 진행합니다", new ConversationPersistenceException(
			conversationId, operation, error));
		return Mono.empty();
	}

	private static boolean isRepeatedUserTurn(List<Turn> turns, String content) {
		if (turns.isEmpty()) {
			return false;
		}
		Turn last = turns.get(turns.size() - 1);
		return last.isUser() && last.content().equals(content);
	}

	private static List<Turn> append(List<Turn> turns, Turn turn) {
		List<Turn> updated = new ArrayList<>(turns.size() + 1);
		updated.addAll(turns);
		updated.add(turn);
		return List.copyOf(updated);
	}
}
