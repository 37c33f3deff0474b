package com.routergen.config;

import com.routergen.core.backend.Backend;
import com.routergen.core.backend.BackendPool;
import com.routergen.core.backend.BackendSelectionStrategy;
import com.routergen.core.backend.RoundRobinStrategy;
import com.routergen.core.backend.WeightedRotationStrategy;
import com.routergen.llm.LLMClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.stream.Collectors;

@Configuration
public class BackendPoolConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BackendPoolConfiguration.class);

    @Bean
    public BackendPool backendPool(PipelineConfig config, LLMClientFactory clientFactory) {
        if (config.getBackends().isEmpty()) {
            throw new IllegalStateException("No backends configured (routergen.backends is empty)");
        }

        List<Backend> backends = config.getBackends().stream()
                .map(def -> new Backend(def.getId(), clientFactory.create(def), def.getWeight(), def.getTags()))
                .collect(Collectors.toList());

        BackendSelectionStrategy strategy = switch (config.getPoolSettings().getStrategy()) {
            case WEIGHTED    -> new WeightedRotationStrategy(config.getSeed());
            case ROUND_ROBIN -> new RoundRobinStrategy();
        };

        log.info("[Config] Backend selection strategy: {}", strategy.getClass().getSimpleName());
        return new BackendPool(backends, strategy, config.getPoolSettings());
    }
}
