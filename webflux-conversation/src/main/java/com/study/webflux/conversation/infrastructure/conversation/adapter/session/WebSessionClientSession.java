package com.study.webflux.conversation.infrastructure.conversation.adapter.session;

import java.util.Optional;

import org.springframework.web.server.WebSession;

import com.study.webflux.conversation.domain.conversation.model.ActiveConversation;
import com.study.webflux.conversation.domain.conversation.model.ConversationId;
import com.study.webflux.conversation.domain.conversation.port.ClientSession;
import reactor.core.publisher.Mono;

/** WebFlux {@link WebSession} 속성에 현재 대화를 보관합니다. */
public class WebSessionClientSession implements ClientSession {

	static final String ACTIVE_ID_ATTRIBUTE = "conversation.activeId";
	static final String TEMPORARY_ATTRIBUTE = "conversation.temporary";

	private final WebSession webSession;

	public WebSessionClientSession(WebSession webSession) {
		this.webSession = webSession;
	}

	@Override
	public String id() {
		return webSession.getId();
	}

	@Override
	public Optional<ActiveConversation> activeConversation() {
		String activeId = webSession.getAttribute(ACTIVE_ID_ATTRIBUTE);
		if (activeId == null || activeId.isBlank()) {
			return Optional.empty();
		}
		Boolean temporary = webSession.getAttribute(TEMPORARY_ATTRIBUTE);
		return Optional.of(new ActiveConversation(ConversationId.of(activeId),
			Boolean.TRUE.equals(temporary)));
	}

	@Override
	public Mono<Void> bind(ActiveConversation activeConversation) {
		webSession.getAttributes().put(ACTIVE_ID_ATTRIBUTE, activeConversation.id().value());
		webSession.getAttributes().put(TEMPORARY_ATTRIBUTE, activeConversation.temporary());
		webSession.start();
		return webSession.save();
	}
}
