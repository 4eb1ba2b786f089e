package edu.washu.tag.extractor.pathosys.config;

import java.net.http.HttpClient;
import java.time.Duration;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration class for the HTTP client used to reach the dataset management API.
 */
@Configuration
public class DatasetApiConfig {

    @Value("${scout.datasetApi.connectTimeoutSeconds:10}")
    private Integer connectTimeoutSeconds;

    /**
     * Creates the HTTP client bean.
     *
     * @return Configured HttpClient instance.
     */
    @Bean
    public HttpClient datasetApiHttpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(ObjectUtils.defaultIfNull(connectTimeoutSeconds, 10)))
            .build();
    }
}
