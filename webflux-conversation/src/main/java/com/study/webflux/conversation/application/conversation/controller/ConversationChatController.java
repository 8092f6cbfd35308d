package com.study.webflux.conversation.application.conversation.controller;

import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebSession;

import com.study.webflux.conversation.application.conversation.controller.docs.ConversationChatApi;
import com.study.webflux.conversation.application.conversation.dto.ChatMessageRequest;
import com.study.webflux.conversation.application.conversation.dto.ChatMessageResponse;
import com.study.webflux.conversation.application.conversation.dto.ConversationResponse;
import com.study.webflux.conversation.application.conversation.dto.ResetConversationRequest;
import com.study.webflux.conversation.application.conversation.dto.ResetConversationResponse;
import com.study.webflux.conversation.domain.conversation.model.ChatStreamEvent;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.HistoryEntry;
import com.study.webflux.conversation.domain.conversation.port.ConversationChatUseCase;
import com.study.webflux.conversation.infrastructure.conversation.adapter.session.WebSessionClientSession;
import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/chat")
public class ConversationChatController implements ConversationChatApi {

	private final ConversationChatUseCase chatUseCase;
	private final RequestIdentityResolver identityResolver;

	@PostMapping("/message")
	public Mono<ChatMessageResponse> submitMessage(
		@Valid @RequestBody ChatMessageRequest request,
		WebSession webSession,
		ServerWebExchange exchange) {
		return identityResolver.resolve(exchange)
			.flatMap(owner -> chatUseCase.submitMessage(new WebSessionClientSession(webSession),
				owner.orElse(null),
				request.message(),
				request.isTemporary()))
			.map(conversationId -> new ChatMessageResponse(conversationId.value()));
	}

	@RequestMapping(path = "/stream", method = {RequestMethod.GET,
		RequestMethod.POST}, produces = MediaType.TEXT_EVENT_STREAM_VALUE)
	public Flux<ChatStreamEvent> streamResponse(WebSession webSession, ServerWebExchange exchange) {
		return identityResolver.resolve(exchange)
			.flatMapMany(owner -> chatUseCase
				.streamResponse(new WebSessionClientSession(webSession), owner.orElse(null)));
	}

	@PostMapping("/reset")
	public Mono<ResetConversationResponse> reset(
		@RequestBody(required = false) ResetConversationRequest request,
		WebSession webSession,
		ServerWebExchange exchange) {
		boolean wasTemporary = request != null && request.wasTemporary();
		return identityResolver.resolve(exchange)
			.flatMap(owner -> chatUseCase.reset(new WebSessionClientSession(webSession),
				owner.orElse(null),
				wasTemporary))
			.map(conversationId -> new ResetConversationResponse(conversationId.value()));
	}

	@GetMapping("/history")
	public Mono<Map<String, List<HistoryEntry>>> history(WebSession webSession,
		ServerWebExchange exchange) {
		return identityResolver.resolve(exchange)
			.flatMap(owner -> chatUseCase.listHistory(new WebSessionClientSession(webSession),
				owner.orElse(null)));
	}

	@GetMapping("/conversations/{conversationId}")
	public Mono<ConversationResponse> getConversation(
		@PathVariable String conversationId,
		WebSession webSession,
		ServerWebExchange exchange) {
		return identityResolver.resolve(exchange)
			.flatMap(owner -> chatUseCase.getConversation(new WebSessionClientSession(webSession),
				owner.orElse(null),
				ConversationId.of(conversationId)))
			.map(ConversationResponse::from);
	}
}
