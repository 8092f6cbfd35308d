package com.study.webflux.conversation.domain.conversation.port;

import java.util.List;
import java.util.Map;

import com.study.webflux.conversation.domain.conversation.model.ChatStreamEvent;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.model.ConversationView;
import com.study.webflux.conversation.domain.conversation.model.HistoryEntry;
import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * ConversationChatUseCase는 세션 기반 대화 흐름을 정의합니다. owner가 null이면 익명 요청입니다.
 */
public interface ConversationChatUseCase {

	/**
	 * 사용자 메시지를 현재 대화에 추가합니다.
	 *
	 * @param message
	 *            사용자 메시지
	 * @param temporary
	 *            새 대화를 만들 경우 임시 대화 여부
	 * @return 메시지가 추가된 대화 ID
	 */
	Mono<ConversationId> submitMessage(ClientSession session, OwnerId owner, String message,
		boolean temporary);

	/**
	 * 현재 대화의 응답을 스트리밍합니다. 실패는 에러 이벤트로 전달됩니다.
	 */
	Flux<ChatStreamEvent> streamResponse(ClientSession session, OwnerId owner);

	Mono<ConversationView> getConversation(ClientSession session, OwnerId owner,
		ConversationId conversationId);

	Mono<ConversationId> reset(ClientSession session, OwnerId owner, boolean wasTemporary);

	Mono<Map<String, List<HistoryEntry>>> listHistory(ClientSession session, OwnerId owner);
}
