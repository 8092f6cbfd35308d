package com.study.webflux.conversation.domain.conversation.exception;

import com.study.webflux.conversation.domain.conversation.model.ConversationId;

/** 다른 소유자의 대화에 접근하려 할 때 발생합니다. */
public class ConversationAccessDeniedException extends ConversationException {

	public ConversationAccessDeniedException(ConversationId conversationId) {
		super("Unauthorized access to conversation: " + conversationId.value());
	}
}
