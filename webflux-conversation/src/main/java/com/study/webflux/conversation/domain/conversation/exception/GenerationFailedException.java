package com.study.webflux.conversation.domain.conversation.exception;

/** 생성 모델 호출이 실패했을 때 발생합니다. 자동으로 재시도하지 않습니다. */
public class GenerationFailedException extends ConversationException {

	public GenerationFailedException(String message) {
		super(message);
	}

	public GenerationFailedException(String message, Throwable cause) {
		super(message, cause);
	}
}
