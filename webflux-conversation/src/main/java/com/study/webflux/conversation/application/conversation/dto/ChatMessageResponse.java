package com.study.webflux.conversation.application.conversation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "메시지 전송 Response")
public record ChatMessageResponse(
	@Schema(description = "스트리밍에 사용할 대화 ID") String conversationId
) {
}
