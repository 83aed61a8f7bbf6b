package org.nowstart.scanner.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@RequiredArgsConstructor
public class SwaggerConfig {

    private final BuildProperties buildProperties;

    @Bean
    public OpenAPI scannerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title(buildProperties.getName() + " API")
                        .description("EMA/ATR 신호 스캐너와 백테스트 엔진의 API 문서입니다.")
                        .version(buildProperties.getVersion()));
    }
}
