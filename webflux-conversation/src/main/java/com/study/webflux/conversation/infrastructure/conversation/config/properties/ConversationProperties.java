package com.study.webflux.conversation.infrastructure.conversation.config.properties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "conversation")
public class ConversationProperties {

	private String systemPrompt = "You are a helpful assistant.";

	/** system 메시지를 제외하고 유지할 최대 메시지 수입니다. */
	private int maxHistory = 10;

	private Cache cache = new Cache();

	private Generation generation = new Generation();

	private History history = new History();

	private Stream stream = new Stream();

	private Identity identity = new Identity();

	@Getter
	@Setter
	public static class Cache {

		private String keyPrefix = "chat";

		private String version = "1.0.0";

		private Duration ttl = Duration.ofHours(1);

		/** 시작 시 이전 버전 키를 정리할 네임스페이스 목록입니다. */
		private List<String> purgeNamespaces = new ArrayList<>(List.of("chat", "session"));
	}

	@Getter
	@Setter
	public static class Generation {

		private String model = "gpt-4o-mini";

		private int maxTokens = 2048;

		private double temperature = 0.7;
	}

	@Getter
	@Setter
	public static class History {

		private int maxResults = 100;

		private int previewLength = 50;
	}

	@Getter
	@Setter
	public static class Stream {

		/** 생성 모델의 다음 이벤트를 기다리는 최대 시간입니다. 0이면 제한하지 않습니다. */
		private Duration idleTimeout = Duration.ZERO;
	}

	@Getter
	@Setter
	public static class Identity {

		private String ownerHeader = "X-Owner-Id";
	}
}
