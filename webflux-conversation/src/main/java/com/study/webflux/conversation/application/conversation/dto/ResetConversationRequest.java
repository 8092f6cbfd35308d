package com.study.webflux.conversation.application.conversation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "대화 초기화 Request")
public record ResetConversationRequest(
	@Schema(description = "현재 대화가 임시 대화였는지 여부. 새 대화에도 같은 모드가 적용됩니다", example = "false")
	boolean wasTemporary
) {
}
