package com.study.webflux.conversation.domain.conversation.model;

import java.util.List;

/** 클라이언트에 보여줄 대화 내용입니다. system 메시지는 포함하지 않습니다. */
public record ConversationView(
	ConversationId conversationId,
	List<Turn> turns
) {
	public static ConversationView of(ConversationId conversationId, List<Turn> turns) {
		return new ConversationView(conversationId,
			turns.stream().filter(turn -> !turn.isSystem()).toList());
	}
}
