package com.study.webflux.conversation.domain.conversation.exception;

import com.study.webflux.conversation.domain.conversation.model.ConversationId;

/** 같은 대화에서 이미 응답을 생성하고 있을 때 발생합니다. */
public class GenerationInProgressException extends ConversationException {

	public GenerationInProgressException(ConversationId conversationId) {
		super("Response generation already in progress for conversation: "
			+ conversationId.value());
	}
}
