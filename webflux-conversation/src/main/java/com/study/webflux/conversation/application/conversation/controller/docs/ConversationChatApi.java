package com.study.webflux.conversation.application.conversation.controller.docs;

import java.util.List;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebSession;

import com.study.webflux.conversation.application.conversation.dto.ChatMessageRequest;
import com.study.webflux.conversation.application.conversation.dto.ChatMessageResponse;
import com.study.webflux.conversation.application.conversation.dto.ConversationResponse;
import com.study.webflux.conversation.application.conversation.dto.ResetConversationRequest;
import com.study.webflux.conversation.application.conversation.dto.ResetConversationResponse;
import com.study.webflux.conversation.domain.conversation.model.ChatStreamEvent;
import com.study.webflux.conversation.domain.conversation.model.HistoryEntry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Tag(
	name = "채팅 API",
	description = "세션 기반 대화 생성, 응답 스트리밍, 대화 기록 조회"
)
public interface ConversationChatApi {

	@Operation(
		summary = "사용자 메시지 전송",
		description = "세션의 현재 대화에 메시지를 추가합니다. 바인딩된 대화가 없으면 새 대화를 만듭니다"
	)
	@ApiResponse(responseCode = "200", description = "메시지가 추가된 대화 ID")
	@ApiResponse(responseCode = "400", description = "빈 메시지")
	Mono<ChatMessageResponse> submitMessage(
		ChatMessageRequest request,
		@Parameter(hidden = true) WebSession webSession,
		@Parameter(hidden = true) ServerWebExchange exchange
	);

	@Operation(
		summary = "응답 스트리밍",
		description = "현재 대화의 응답을 SSE로 전달합니다. {\"content\": ...} 이벤트 뒤에 [DONE] 이벤트로 끝나며, 실패 시 {\"error\": ...} 이벤트를 보냅니다"
	)
	@ApiResponse(
		responseCode = "200",
		description = "스트리밍 응답",
		content = @Content(mediaType = MediaType.TEXT_EVENT_STREAM_VALUE)
	)
	Flux<ChatStreamEvent> streamResponse(
		@Parameter(hidden = true) WebSession webSession,
		@Parameter(hidden = true) ServerWebExchange exchange
	);

	@Operation(
		summary = "대화 초기화",
		description = "현재 대화를 종료하고 새 대화를 바인딩합니다"
	)
	@ApiResponse(responseCode = "200", description = "새 대화 ID")
	Mono<ResetConversationResponse> reset(
		ResetConversationRequest request,
		@Parameter(hidden = true) WebSession webSession,
		@Parameter(hidden = true) ServerWebExchange exchange
	);

	@Operation(
		summary = "대화 목록 조회",
		description = "Today / Previous 7 Days / Previous 30 Days로 묶은 대화 목록을 반환합니다"
	)
	@ApiResponse(responseCode = "200", description = "그룹별 대화 목록")
	Mono<Map<String, List<HistoryEntry>>> history(
		@Parameter(hidden = true) WebSession webSession,
		@Parameter(hidden = true) ServerWebExchange exchange
	);

	@Operation(
		summary = "대화 상세 조회",
		description = "대화 내용을 반환하고 세션을 해당 대화로 다시 바인딩합니다"
	)
	@ApiResponse(responseCode = "200", description = "대화 내용")
	@ApiResponse(responseCode = "403", description = "다른 사용자의 대화")
	@ApiResponse(responseCode = "404", description = "존재하지 않는 대화")
	Mono<ConversationResponse> getConversation(
		@Parameter(description = "대화 ID") String conversationId,
		@Parameter(hidden = true) WebSession webSession,
		@Parameter(hidden = true) ServerWebExchange exchange
	);
}
