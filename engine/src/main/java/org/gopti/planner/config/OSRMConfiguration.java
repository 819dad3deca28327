package org.gopti.planner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "osrm")
public class OSRMConfiguration {
    private String baseUrl = "http://localhost:5000";
    private String tableEndpoint = "table/v1/foot";
    private String tableParams = "annotations=duration,distance";
    private String routeEndpoint = "route/v1/foot";
    private String routeParams = "overview=full&geometries=polyline";

    /* Applied to both connect and read of every call */
    private Duration timeout = Duration.ofSeconds(5);

    /* Largest coordinate count sent in one table request */
    private int batchSize = 50;
}
