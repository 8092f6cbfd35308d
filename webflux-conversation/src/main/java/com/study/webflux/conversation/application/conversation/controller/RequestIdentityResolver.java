package com.study.webflux.conversation.application.conversation.controller;

import java.security.Principal;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;

import com.study.webflux.conversation.domain.conversation.model.OwnerId;
import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;
import reactor.core.publisher.Mono;

/**
 * 요청자 식별자를 결정합니다. 인증된 Principal을 우선 사용하고, 없으면 설정된 헤더를 사용합니다. 둘 다 없으면 익명입니다.
 */
@Component
public class RequestIdentityResolver {

	private final String ownerHeader;

	public RequestIdentityResolver(ConversationProperties properties) {
		this.ownerHeader = properties.getIdentity().getOwnerHeader();
	}

	public Mono<Optional<OwnerId>> resolve(ServerWebExchange exchange) {
		Optional<OwnerId> fromHeader = Optional
			.ofNullable(OwnerId.ofNullable(exchange.getRequest().getHeaders().getFirst(ownerHeader)));
		return exchange.getPrincipal()
			.map(Principal::getName)
			.map(name -> Optional.ofNullable(OwnerId.ofNullable(name)))
			.filter(Optional::isPresent)
			.defaultIfEmpty(fromHeader);
	}
}
