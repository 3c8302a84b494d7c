package eu.virtualparadox.docalign.application.config;

import eu.virtualparadox.docalign.text.cleaner.CleaningOptions;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import jakarta.annotation.PostConstruct;

@Configuration
@ConfigurationProperties(prefix = "docalign")
@Getter @Setter
public class ApplicationConfig {

    private Resource alphabet;
    private boolean lowercase = true;
    private boolean collapseWhitespace = true;
    private boolean dashesToSpace = true;
    private int workers = 0;
    private int limitFactor = 2;

    @PostConstruct
    public void validate() {
        if (alphabet == null || !alphabet.exists()) {
            throw new IllegalStateException("docalign.alphabet must point to an existing alphabet file, got: "
                    + (alphabet == null ? "nothing" : alphabet.getDescription()));
        }
        if (workers < 0) {
            throw new IllegalStateException("docalign.workers cannot be negative");
        }
        if (limitFactor < 1) {
            throw new IllegalStateException("docalign.limit-factor must be at least 1");
        }
    }

    public CleaningOptions getCleaningOptions() {
        return new CleaningOptions(lowercase, collapseWhitespace, dashesToSpace);
    }
}
