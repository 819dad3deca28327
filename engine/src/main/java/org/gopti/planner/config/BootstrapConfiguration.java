package org.gopti.planner.config;

import com.google.ortools.Loader;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

@Component
@Scope("singleton")
public class BootstrapConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(BootstrapConfiguration.class);

    @PostConstruct
    public void init() {
        Loader.loadNativeLibraries();
        logger.info("OR-Tools native libraries loaded");
    }
}
