package com.study.webflux.conversation.domain.conversation.port;

import com.study.webflux.conversation.domain.conversation.exception.ConversationAccessDeniedException;
import com.study.webflux.conversation.domain.conversation.model.Conversation;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.ConversationQuery;
import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 완료되었거나 영구 보존 대상인 대화를 저장하는 영속 저장소 포트입니다.
 *
 * <p>
 * 호출자 입장에서 대화는 추가만 가능하며 단건 삭제는 제공하지 않습니다.
 */
public interface ConversationRepository {

	Mono<Conversation> upsert(Conversation conversation);

	Mono<Conversation> findById(ConversationId conversationId);

	/** 소유자 필터와 조회 조건에 맞는 대화를 최근 활동 순으로 조회합니다. ownerId가 null이면 익명 대화만 조회합니다. */
	Flux<Conversation> findByOwner(OwnerId ownerId, ConversationQuery query);

	/** 계정 삭제 시에만 사용합니다. */
	Mono<Long> deleteAllByOwner(OwnerId ownerId);

	/**
	 * 요청자의 접근 권한을 확인하며 대화를 조회합니다.
	 *
	 * @param requester
	 *            요청자, 익명이면 null
	 * @return 대화가 없으면 빈 Mono, 다른 소유자의 대화이면 {@link ConversationAccessDeniedException}
	 */
	default Mono<Conversation> findById(ConversationId conversationId, OwnerId requester) {
		return findById(conversationId).flatMap(conversation -> conversation.isAccessibleBy(requester)
			? Mono.just(conversation)
			: Mono.error(new ConversationAccessDeniedException(conversationId)));
	}
}
