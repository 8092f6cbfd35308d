package com.study.webflux.conversation.application.conversation.dto;

import java.util.List;

import com.study.webflux.conversation.domain.conversation.model.ConversationView;
import com.study.webflux.conversation.domain.conversation.model.Turn;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "대화 상세 Response")
public record ConversationResponse(
	@Schema(description = "대화 ID") String conversationId,
	@Schema(description = "system 메시지를 제외한 대화 내용") List<Turn> chatHistory
) {
	public static ConversationResponse from(ConversationView view) {
		return new ConversationResponse(view.conversationId().value(), view.turns());
	}
}
