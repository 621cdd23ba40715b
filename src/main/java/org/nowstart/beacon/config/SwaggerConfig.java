package org.nowstart.beacon.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final BuildProperties buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("beacon API")
                        .description("심볼별 매매 신호(PREVIEW/CONFIRMED/INVALIDATED) 평가 API 문서입니다.")
                        .version(buildProperties.getVersion()));
    }

    @Bean
    public GroupedOpenApi signalApi() {
        return GroupedOpenApi.builder()
                .group("signals")
                .pathsToMatch("/api/signals/**")
                .build();
    }
}
