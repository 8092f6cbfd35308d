package com.study.webflux.conversation.application.conversation.service;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.conversation.domain.conversation.model.ActiveConversation;
import com.study.webflux.conversation.domain.conversation.model.ConversationHandle;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import com.study.webflux.conversation.domain.conversation.port.ClientSession;
import com.study.webflux.conversation.infrastructure.monitoring.config.ConversationMetricsConfiguration;
import reactor.core.publisher.Mono;

/**
 * 클라이언트 세션과 현재 대화를 연결합니다.
 *
 * <p>
 * 세션마다 하나의 대화만 바인딩되며, 바인딩 변경은 세션 저장이 끝난 뒤에 완료됩니다. 같은 세션의 초기화 요청은 순서대로 처리됩니다.
 */
@Slf4j
@Service
public class SessionBinderService {

	private final ConversationHistoryCoordinator historyCoordinator;
	private final ConversationMetricsConfiguration metrics;
	private final ConcurrentMap<String, Mono<ConversationId>> pendingResets = new ConcurrentHashMap<>();

	public SessionBinderService(ConversationHistoryCoordinator historyCoordinator,
		ConversationMetricsConfiguration metrics) {
		this.historyCoordinator = historyCoordinator;
		this.metrics = metrics;
	}

	/**
	 * 세션에 바인딩된 대화를 반환합니다. 없으면 요청한 모드로 새 대화를 만들어 바인딩합니다.
	 *
	 * <p>
	 * 이미 바인딩된 대화의 temporary 여부는 바뀌지 않습니다.
	 */
	public Mono<ConversationHandle> resolveActive(ClientSession session, OwnerId owner,
		boolean temporary) {
		return Mono.defer(() -> session.activeConversation()
			.map(active -> {
				if (active.temporary() != temporary) {
					log.warn("바인딩된 대화의 모드와 요청 모드가 다릅니다. 기존 모드를 유지합니다: conversationId={}, temporary={}",
						active.id(),
						active.temporary());
				}
				return Mono.just(active.toHandle(owner));
			})
			.orElseGet(() -> {
				ActiveConversation created = ActiveConversation.create(temporary);
				return session.bind(created)
					.doOnSuccess(v -> log.info("새 대화 바인딩: sessionId={}, conversationId={}, temporary={}",
						session.id(),
						created.id(),
						temporary))
					.thenReturn(created.toHandle(owner));
			}));
	}

	/**
	 * 현재 대화를 종료하고 새 대화를 바인딩합니다. 새 대화가 영구 모드이면 빈 기록을 미리 만듭니다.
	 *
	 * @param wasTemporary
	 *            클라이언트가 사용 중이던 임시 대화 모드, 새 대화에도 같은 모드가 적용됩니다
	 * @return 새 대화 ID
	 */
	public Mono<ConversationId> reset(ClientSession session, OwnerId owner, boolean wasTemporary) {
		return Mono.defer(() -> {
			String sessionId = session.id();
			Mono<ConversationId> link = pendingResets.compute(sessionId, (key, previous) -> {
				Mono<Void> preceding = previous == null
					? Mono.empty()
					: previous.then().onErrorResume(error -> Mono.empty());
				return preceding.then(Mono.defer(() -> resetNow(session, owner, wasTemporary)))
					.cache();
			});
			return link.doFinally(signal -> pendingResets.remove(sessionId, link));
		});
	}

	/** 기록에서 선택한 기존 대화로 세션을 다시 바인딩합니다. 이전 대화는 종료하지 않습니다. */
	public Mono<Void> bind(ClientSession session, ConversationId conversationId, boolean temporary) {
		return session.bind(new ActiveConversation(conversationId, temporary))
			.doOnSuccess(v -> log.debug("대화 재바인딩: sessionId={}, conversationId={}", session.id(),
				conversationId));
	}

	private Mono<ConversationId> resetNow(ClientSession session, OwnerId owner,
		boolean wasTemporary) {
		Optional<ActiveConversation> current = session.activeConversation();
		Mono<Void> finalizeCurrent = current
			.map(active -> historyCoordinator.finalizeConversation(
				active.toHandle(owner).asTemporary(wasTemporary || active.temporary())))
			.orElseGet(Mono::empty);

		ActiveConversation next = ActiveConversation.create(wasTemporary);
		return finalizeCurrent
			.then(Mono.defer(() -> session.bind(next)))
			.then(Mono.defer(() -> historyCoordinator.createEmptyRecord(next.toHandle(owner))))
			.doOnSuccess(v -> {
				metrics.recordConversationReset();
				log.info("대화 초기화: sessionId={}, previous={}, next={}, temporary={}",
					session.id(),
					current.map(ActiveConversation::id).orElse(null),
					next.id(),
					wasTemporary);
			})
			.thenReturn(next.id());
	}
}
