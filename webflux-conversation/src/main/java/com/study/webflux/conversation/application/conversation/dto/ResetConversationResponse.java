package com.study.webflux.conversation.application.conversation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "대화 초기화 Response")
public record ResetConversationResponse(
	@Schema(description = "새로 바인딩된 대화 ID") String newConversationId
) {
}
