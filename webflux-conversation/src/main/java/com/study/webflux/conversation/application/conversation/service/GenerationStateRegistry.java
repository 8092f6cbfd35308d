package com.study.webflux.conversation.application.conversation.service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.springframework.stereotype.Component;

import com.study.webflux.conversation.domain.conversation.model.ConversationId;

/**
 * 대화별 응답 생성 상태(IDLE / STREAMING)를 관리합니다. 한 대화에서 동시에 하나의 생성만 허용합니다.
 */
@Component
public class GenerationStateRegistry {

	public enum State {
		IDLE,
		STREAMING
	}

	private final ConcurrentMap<ConversationId, State> states = new ConcurrentHashMap<>();

	/** IDLE이면 STREAMING으로 전환하고 true를 반환합니다. 이미 STREAMING이면 false입니다. */
	public boolean tryStart(ConversationId conversationId) {
		return states.putIfAbsent(conversationId, State.STREAMING) == null;
	}

	public void release(ConversationId conversationId) {
		states.remove(conversationId);
	}

	public State stateOf(ConversationId conversationId) {
		return states.getOrDefault(conversationId, State.IDLE);
	}
}
