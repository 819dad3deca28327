package org.gopti.planner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SpringConfiguration {

    @Bean
    public RestClient restClient(OSRMConfiguration osrmConfig) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) osrmConfig.getTimeout().toMillis());
        requestFactory.setReadTimeout((int) osrmConfig.getTimeout().toMillis());
        return RestClient.builder()
            .requestFactory(requestFactory)
            .build();
    }

    /* Bounds concurrent travel-time lookups to respect provider rate limits */
    @Bean
    public ExecutorService lookupExecutor(PlannerProperties properties) {
        return Executors.newFixedThreadPool(properties.getTravel().getMaxConcurrentLookups());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
