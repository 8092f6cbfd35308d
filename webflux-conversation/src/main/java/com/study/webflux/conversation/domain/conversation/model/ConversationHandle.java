package com.study.webflux.conversation.domain.conversation.model;

/** 요청 처리 중 대화를 식별하고 소유자·보존 모드를 함께 전달합니다. */
public record ConversationHandle(
	ConversationId id,
	OwnerId ownerId,
	boolean temporary
) {
	public ConversationHandle {
		if (id == null) {
			throw new IllegalArgumentException("id cannot be null");
		}
	}

	public ConversationHandle asTemporary(boolean value) {
		return new ConversationHandle(id, ownerId, value);
	}
}
