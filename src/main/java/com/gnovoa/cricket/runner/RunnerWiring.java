package com.gnovoa.cricket.runner;

import com.gnovoa.cricket.config.SimProperties;
import com.gnovoa.cricket.core.EngineOptions;
import com.gnovoa.cricket.core.MatchRuntimeFactory;
import com.gnovoa.cricket.out.EventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RunnerWiring {

    @Bean
    public EngineOptions engineOptions(RunnerProperties props) {
        return new EngineOptions(props.ballsPerTick(), props.autoDeclare(), props.autoFollowOn());
    }

    @Bean
    public MatchRuntimeFactory matchRuntimeFactory(EventPublisher publisher, SimProperties simProps, EngineOptions options) {
        return new MatchRuntimeFactory(publisher, simProps, options);
    }
}
