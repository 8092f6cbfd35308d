package com.study.webflux.conversation.domain.conversation.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 클라이언트로 전송되는 SSE 이벤트입니다.
 *
 * <p>
 * 생성 중에는 {@code {"content": "..."}}, 종료 시 {@code {"content": "[DONE]", "fullResponse": "...",
 * "completed": true}}, 실패 시 {@code {"error": "..."}} 형태로 직렬화됩니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatStreamEvent(
	String content,
	String fullResponse,
	Boolean completed,
	String error
) {
	public static final String DONE_MARKER = "[DONE]";

	public static ChatStreamEvent content(String delta) {
		return new ChatStreamEvent(delta, null, null, null);
	}

	public static ChatStreamEvent done(String fullResponse) {
		return new ChatStreamEvent(DONE_MARKER, fullResponse, Boolean.TRUE, null);
	}

	public static ChatStreamEvent error(String message) {
		return new ChatStreamEvent(null, null, null, message);
	}

	@JsonIgnore
	public boolean isDone() {
		return DONE_MARKER.equals(content) && Boolean.TRUE.equals(completed);
	}
}
