package com.study.webflux.conversation.domain.conversation.exception;

import com.study.webflux.conversation.domain.conversation.model.ConversationId;

public class ConversationNotFoundException extends ConversationException {

	public ConversationNotFoundException(ConversationId conversationId) {
		super("Conversation not found: " + conversationId.value());
	}
}
