package com.study.webflux.conversation.application.conversation.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "메시지 전송 Request")
public record ChatMessageRequest(
	@Schema(description = "사용자 메시지", example = "안녕하세요")
	@NotBlank(message = "message는 필수입니다") String message,

	@Schema(description = "임시 대화 여부. 새 대화를 만들 때만 적용됩니다", example = "false")
	boolean isTemporary
) {
}
