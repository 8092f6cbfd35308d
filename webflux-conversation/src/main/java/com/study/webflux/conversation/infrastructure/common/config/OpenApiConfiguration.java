package com.study.webflux.conversation.infrastructure.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.conversation.infrastructure.conversation.config.properties.ConversationProperties;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.HeaderParameter;

@Configuration
public class OpenApiConfiguration {

	private static final String OWNER_HEADER_PARAMETER = "ownerHeader";

	@Bean
	public OpenAPI conversationOpenAPI(ConversationProperties properties) {
		HeaderParameter ownerHeader = new HeaderParameter();
		ownerHeader.setName(properties.getIdentity().getOwnerHeader());
		ownerHeader.setDescription("인증 정보가 없을 때 사용할 대화 소유자 ID, 생략하면 익명 대화");
		ownerHeader.setRequired(false);
		ownerHeader.setSchema(new StringSchema().maxLength(128));

		return new OpenAPI()
			.info(new Info()
				.title("Conversation Chat API")
				.description("세션에 바인딩된 대화의 메시지 전송, 응답 스트리밍, 초기화, 기록 조회 API")
				.version("1.0.0"))
			.components(new Components().addParameters(OWNER_HEADER_PARAMETER, ownerHeader));
	}
}
