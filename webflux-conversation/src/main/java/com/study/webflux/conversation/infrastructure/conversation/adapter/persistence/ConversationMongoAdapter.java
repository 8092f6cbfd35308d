package com.study.webflux.conversation.infrastructure.conversation.adapter.persistence;

import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import com.study.webflux.conversation.domain.conversation.entity.ConversationEntity;
import com.study.webflux.conversation.domain.conversation.entity.ConversationEntity.TurnDocument;
import com.study.webflux.conversation.domain.conversation.model.Conversation;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.ConversationQuery;
import com.study.webflux.conversation.domain.conversation.model.MessageRole;
import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import com.study.webflux.conversation.domain.conversation.port.ConversationRepository;
import com.study.webflux.conversation.infrastructure.conversation.repository.ConversationMongoRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** MongoDB 기반 대화 저장소 어댑터입니다. */
@Component
public class ConversationMongoAdapter implements ConversationRepository {

	private static final Sort RECENT_FIRST = Sort.by(Sort.Direction.DESC, "updatedAt")
		.and(Sort.by(Sort.Direction.DESC, "endedAt"));

	private final ConversationMongoRepository mongoRepository;

	public ConversationMongoAdapter(ConversationMongoRepository mongoRepository) {
		this.mongoRepository = mongoRepository;
	}

	/** 대화 ID를 키로 전체 문서를 교체합니다. 임시 대화는 저장하지 않습니다. */
	@Override
	public Mono<Conversation> upsert(Conversation conversation) {
		if (conversation.temporary()) {
			return Mono.error(new IllegalArgumentException(
				"temporary conversation cannot be persisted: " + conversation.id()));
		}
		return mongoRepository.save(toEntity(conversation))
			.map(this::toConversation);
	}

	@Override
	public Mono<Conversation> findById(ConversationId conversationId) {
		return mongoRepository.findById(conversationId.value())
			.map(this::toConversation);
	}

	@Override
	public Flux<Conversation> findByOwner(OwnerId ownerId, ConversationQuery query) {
		String activeId = query.includesActive() ? query.activeConversationId().value() : null;
		return mongoRepository
			.findListable(OwnerId.valueOf(ownerId), activeId, PageRequest.of(0, query.limit(), RECENT_FIRST))
			.map(this::toConversation);
	}

	@Override
	public Mono<Long> deleteAllByOwner(OwnerId ownerId) {
		if (ownerId == null) {
			return Mono.error(new IllegalArgumentException("ownerId cannot be null"));
		}
		return mongoRepository.deleteByOwnerId(ownerId.value());
	}

	private ConversationEntity toEntity(Conversation conversation) {
		List<TurnDocument> turns = conversation.turns().stream()
			.map(turn -> new TurnDocument(turn.role().getValue(), turn.content()))
			.toList();
		return new ConversationEntity(
			conversation.id().value(),
			OwnerId.valueOf(conversation.ownerId()),
			turns,
			conversation.startedAt(),
			conversation.endedAt(),
			conversation.updatedAt(),
			conversation.temporary());
	}

	private Conversation toConversation(ConversationEntity entity) {
		List<Turn> turns = entity.turns() == null
			? List.of()
			: entity.turns().stream()
				.map(doc -> new Turn(MessageRole.from(doc.role()), doc.content()))
				.toList();
		return new Conversation(
			ConversationId.of(entity.conversationId()),
			OwnerId.ofNullable(entity.ownerId()),
			turns,
			entity.startedAt(),
			entity.endedAt(),
			entity.updatedAt(),
			entity.temporary());
	}
}
