package com.keacast.assistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class WebClientConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public WebClient aiWebClient(AiProperties props) {
        // Authorization 只在配置了 key 时附加
        ExchangeFilterFunction auth = (request, next) -> {
            String key = props.getApiKey();
            ClientRequest.Builder b = ClientRequest.from(request);
            if (key != null && !key.isBlank()) {
                b.headers(h -> h.setBearerAuth(key));
            } else {
                b.headers(h -> h.remove("Authorization"));
            }
            return next.exchange(b.build());
        };

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .filter(auth)
                .build();
    }

    @Bean
    public WebClient keacastWebClient(KeacastApiProperties props) {
        return WebClient.builder()
                .baseUrl(props.getBaseUrl().replaceAll("/+$", ""))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(props.getMaxInMemoryBytes()))
                .build();
    }
}
