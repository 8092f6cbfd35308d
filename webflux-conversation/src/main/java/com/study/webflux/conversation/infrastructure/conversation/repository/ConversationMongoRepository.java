package com.study.webflux.conversation.infrastructure.conversation.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;

import com.study.webflux.conversation.domain.conversation.entity.ConversationEntity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ConversationMongoRepository
	extends
		ReactiveMongoRepository<ConversationEntity, String> {

	/** 종료된 대화와 activeId에 해당하는 진행 중 대화를 조회합니다. ownerId가 null이면 익명 대화만 대상입니다. */
	@Query("{ 'temporary': false, 'ownerId': ?0, '$or': [ { 'endedAt': { '$ne': null } }, { '_id': ?1 } ] }")
	Flux<ConversationEntity> findListable(String ownerId, String activeId, Pageable pageable);

	Mono<Long> deleteByOwnerId(String ownerId);
}
