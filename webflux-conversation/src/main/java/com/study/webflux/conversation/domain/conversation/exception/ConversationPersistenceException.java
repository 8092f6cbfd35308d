package com.study.webflux.conversation.domain.conversation.exception;

import com.study.webflux.conversation.domain.conversation.model.ConversationId;

/**
 * 영속 저장소 접근 실패를 나타냅니다. 쓰기 실패는 로그로만 남기고, 대화 모드를 판단할 수 없는 조회 실패는 호출자에게 전달됩니다.
 */
public class ConversationPersistenceException extends ConversationException {

	public ConversationPersistenceException(ConversationId conversationId, String operation,
		Throwable cause) {
		super("Failed to " + operation + " conversation " + conversationId.value(), cause);
	}
}
