package com.study.webflux.conversation.domain.conversation.exception;

/** 대화 처리 중 발생하는 도메인 예외의 공통 상위 타입입니다. */
public abstract class ConversationException extends RuntimeException {

	protected ConversationException(String message) {
		super(message);
	}

	protected ConversationException(String message, Throwable cause) {
		super(message, cause);
	}
}
