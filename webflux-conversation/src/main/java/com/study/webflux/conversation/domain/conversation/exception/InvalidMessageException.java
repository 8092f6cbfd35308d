package com.study.webflux.conversation.domain.conversation.exception;

public class InvalidMessageException extends ConversationException {

	public InvalidMessageException(String message) {
		super(message);
	}
}
