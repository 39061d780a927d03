package com.eventdocs.render.global.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import com.eventdocs.render.modules.event.domain.Address;

/**
 * Settings under 'render' in application.yml.
 */
@Configuration
@ConfigurationProperties(prefix = "render")
public class RenderProperties {

    private Path input = Path.of("partial_export_event.json");
    private List<String> homeCountries = new ArrayList<>(Address.DEFAULT_HOME_COUNTRIES);

    public Path getInput() {
        return input;
    }

    public void setInput(Path input) {
        this.input = input;
    }

    public List<String> getHomeCountries() {
        return homeCountries;
    }

    public void setHomeCountries(List<String> homeCountries) {
        this.homeCountries = homeCountries;
    }
}
