package com.collabim.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    /**
     * HTTP 与 WS 共用同一个 ObjectMapper：雪花 id 统一按字符串输出，时间按 ISO 字符串输出。
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer idLongJacksonCustomizer() {
        return builder -> {
            IdLongJsonSerializer serializer = new IdLongJsonSerializer();
            builder.serializerByType(Long.class, serializer);
            builder.serializerByType(Long.TYPE, serializer);
            builder.featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        };
    }
}
