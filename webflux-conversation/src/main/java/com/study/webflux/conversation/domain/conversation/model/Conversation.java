package com.study.webflux.conversation.domain.conversation.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 영속 저장소에 기록되는 대화입니다.
 *
 * <p>
 * ownerId가 null이면 익명 대화이며, temporary 대화는 영속 저장소에 기록되지 않습니다.
 */
public record Conversation(
	ConversationId id,
	OwnerId ownerId,
	List<Turn> turns,
	Instant startedAt,
	Instant endedAt,
	Instant updatedAt,
	boolean temporary
) {
	public Conversation {
		if (id == null) {
			throw new IllegalArgumentException("id cannot be null");
		}
		turns = turns == null ? List.of() : List.copyOf(turns);
		if (startedAt == null) {
			startedAt = Instant.now();
		}
		if (updatedAt == null) {
			updatedAt = endedAt != null ? endedAt : startedAt;
		}
	}

	public static Conversation start(ConversationHandle handle, List<Turn> turns, Instant now) {
		return new Conversation(handle.id(), handle.ownerId(), turns, now, null, now,
			handle.temporary());
	}

	public Conversation withTurns(List<Turn> newTurns, Instant now) {
		return new Conversation(id, ownerId, newTurns, startedAt, endedAt, now, temporary);
	}

	public Conversation end(Instant now) {
		return new Conversation(id, ownerId, turns, startedAt, now, now, temporary);
	}

	public boolean isEnded() {
		return endedAt != null;
	}

	public boolean isAnonymous() {
		return ownerId == null;
	}

	/** 익명 요청자이거나 익명 대화이면 접근을 허용합니다. */
	public boolean isAccessibleBy(OwnerId requester) {
		return requester == null || ownerId == null || Objects.equals(ownerId, requester);
	}

	public boolean hasExchange() {
		return turns.stream().anyMatch(Turn::isExchange);
	}
}
