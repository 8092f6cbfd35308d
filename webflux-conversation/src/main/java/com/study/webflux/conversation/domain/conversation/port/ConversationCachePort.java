package com.study.webflux.conversation.domain.conversation.port;

import java.time.Duration;
import java.util.List;

import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import reactor.core.publisher.Mono;

/**
 * 진행 중인 대화의 메시지 목록을 보관하는 캐시 포트입니다.
 *
 * <p>
 * 캐시 장애는 빈 목록 조회와 무시된 쓰기로 처리되며 호출자에게 에러를 전파하지 않습니다.
 */
public interface ConversationCachePort {

	/** 캐시된 메시지 목록을 조회합니다. 없으면 빈 목록을 반환합니다. */
	Mono<List<Turn>> get(ConversationId conversationId);

	Mono<Void> put(ConversationId conversationId, List<Turn> turns, Duration ttl);

	/** 설정된 기본 TTL로 저장합니다. */
	Mono<Void> put(ConversationId conversationId, List<Turn> turns);

	Mono<Void> delete(ConversationId conversationId);

	/** 현재 스키마 버전과 다른 네임스페이스의 항목을 삭제하고 삭제한 개수를 반환합니다. */
	Mono<Long> purgeStaleVersions();
}
