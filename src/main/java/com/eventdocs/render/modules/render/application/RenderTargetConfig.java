package com.eventdocs.render.modules.render.application;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.eventdocs.render.global.config.RenderProperties;

@Configuration
public class RenderTargetConfig {

    @Bean
    public RenderTargetRegistry renderTargetRegistry(RenderProperties properties) {
        return new RenderTargetRegistry()
                .register("tnletters", new ParticipantLetterTarget(properties));
    }
}
