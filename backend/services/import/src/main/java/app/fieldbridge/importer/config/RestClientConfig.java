package app.fieldbridge.importer.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties({CatalogClientProps.class, RecordSinkClientProps.class})
public class RestClientConfig {

    @Bean
    public RestClient catalogRestClient(CatalogClientProps props) {
        return RestClient.builder()
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory(props.connectTimeout(), props.readTimeout()))
                .defaultHeaders(headers -> bearer(headers, props.internalToken()))
                .build();
    }

    @Bean
    public RestClient recordsRestClient(RecordSinkClientProps props) {
        return RestClient.builder()
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory(props.connectTimeout(), props.readTimeout()))
                .defaultHeaders(headers -> bearer(headers, props.internalToken()))
                .build();
    }

    static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }

    private void bearer(HttpHeaders headers, String token) {
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
    }
}
