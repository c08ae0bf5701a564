package com.example.intel.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("portfolio-intel-lite API")
                        .version("0.1.0")
                        .description("보유 종목 + 시장 데이터(Yahoo/NewsAPI/Google News) + LLM 분석 기반 인텔리전스 브리핑 API"));
    }
}
