package com.study.webflux.conversation.domain.conversation.model;

/** 클라이언트 세션에 바인딩된 현재 대화입니다. */
public record ActiveConversation(
	ConversationId id,
	boolean temporary
) {
	public ActiveConversation {
		if (id == null) {
			throw new IllegalArgumentException("id cannot be null");
		}
	}

	public static ActiveConversation create(boolean temporary) {
		return new ActiveConversation(ConversationId.generate(), temporary);
	}

	public ConversationHandle toHandle(OwnerId ownerId) {
		return new ConversationHandle(id, ownerId, temporary);
	}
}
