package com.study.webflux.conversation.infrastructure.common.config;

import java.util.Arrays;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;

/**
 * 채팅 API의 CORS 설정입니다. 대화는 세션 쿠키로 식별되므로 credentials를 허용하고, 소유자 헤더를 허용 헤더에 포함합니다.
 */
@Configuration
public class WebFluxCorsConfiguration implements WebFluxConfigurer {

	private final List<String> allowedOrigins;
	private final String ownerHeader;

	public WebFluxCorsConfiguration(@Value("${web.cors.allowed-origins:}") String allowedOrigins,
		ConversationProperties properties) {
		this.allowedOrigins = Arrays.stream(allowedOrigins.split(","))
			.map(String::trim)
			.filter(origin -> !origin.isEmpty())
			.toList();
		this.ownerHeader = properties.getIdentity().getOwnerHeader();
	}

	@Override
	public void addCorsMappings(CorsRegistry registry) {
		if (allowedOrigins.isEmpty()) {
			return;
		}

		registry.addMapping("/api/chat/**")
			.allowedOrigins(allowedOrigins.toArray(String[]::new))
			.allowedMethods("GET", "POST", "OPTIONS")
			.allowedHeaders(HttpHeaders.CONTENT_TYPE, HttpHeaders.ACCEPT, HttpHeaders.CACHE_CONTROL,
				ownerHeader)
			.allowCredentials(true)
			.maxAge(3600);
	}
}
