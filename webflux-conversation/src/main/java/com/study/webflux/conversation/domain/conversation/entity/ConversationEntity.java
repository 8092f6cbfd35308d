package com.study.webflux.conversation.domain.conversation.entity;

import java.time.Instant;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "conversations")
@CompoundIndexes({
	@CompoundIndex(name = "owner_updated_idx", def = "{'ownerId': 1, 'updatedAt': -1}"),
	@CompoundIndex(name = "owner_ended_idx", def = "{'ownerId': 1, 'endedAt': -1}")
})
public record ConversationEntity(
	@Id String conversationId,
	String ownerId,
	List<TurnDocument> turns,
	Instant startedAt,
	Instant endedAt,
	Instant updatedAt,
	boolean temporary
) {
	public record TurnDocument(
		String role,
		String content
	) {
	}
}
