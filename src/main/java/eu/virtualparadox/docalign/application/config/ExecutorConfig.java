package eu.virtualparadox.docalign.application.config;

import eu.virtualparadox.docalign.util.concurrent.LimitingPool;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "close")
    public LimitingPool alignmentPool(final ApplicationConfig props) {
        return new LimitingPool(props.getWorkers(), props.getLimitFactor());
    }
}
