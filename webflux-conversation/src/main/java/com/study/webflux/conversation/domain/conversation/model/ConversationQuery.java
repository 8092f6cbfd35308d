package com.study.webflux.conversation.domain.conversation.model;

/**
 * 대화 목록 조회 조건입니다. activeConversationId가 있으면 종료되지 않았더라도 해당 대화를 함께 조회합니다.
 */
public record ConversationQuery(
	ConversationId activeConversationId,
	int limit
) {
	public ConversationQuery {
		if (limit <= 0) {
			throw new IllegalArgumentException("limit must be positive");
		}
	}

	public static ConversationQuery endedOnly(int limit) {
		return new ConversationQuery(null, limit);
	}

	public static ConversationQuery endedOrActive(ConversationId activeConversationId, int limit) {
		return new ConversationQuery(activeConversationId, limit);
	}

	public boolean includesActive() {
		return activeConversationId != null;
	}
}
