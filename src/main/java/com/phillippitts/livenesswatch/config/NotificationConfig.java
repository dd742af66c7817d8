package com.phillippitts.livenesswatch.config;

import com.phillippitts.livenesswatch.config.properties.NotificationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP client shared by the channel notifiers.
 *
 * <p>Connect and read timeouts bound each delivery attempt, so a hanging backend delays the
 * fallback to the next channel by at most their sum.
 */
@Configuration
public class NotificationConfig {

    @Bean(name = "notificationRestClient")
    public RestClient notificationRestClient(RestClient.Builder builder, NotificationProperties props) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(props.getConnectTimeoutMs());
        requestFactory.setReadTimeout(props.getReadTimeoutMs());
        return builder
                .requestFactory(requestFactory)
                .build();
    }
}
