package com.study.webflux.conversation.domain.conversation.port;

import java.util.Optional;

import com.study.webflux.conversation.domain.conversation.model.ActiveConversation;
import reactor.core.publisher.Mono;

/** 클라이언트별 세션 저장소입니다. 현재 진행 중인 대화 ID를 보관합니다. */
public interface ClientSession {

	String id();

	Optional<ActiveConversation> activeConversation();

	/** 새 대화를 바인딩하고 세션을 저장합니다. 반환된 Mono가 완료되어야 바인딩이 확정됩니다. */
	Mono<Void> bind(ActiveConversation activeConversation);
}
