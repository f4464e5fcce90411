package app.fieldbridge.importer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.records")
public record RecordSinkClientProps(
        String baseUrl,
        String internalToken,
        @DefaultValue("5s") Duration connectTimeout,
        @DefaultValue("55s") Duration readTimeout
) {
}
