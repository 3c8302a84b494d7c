package eu.virtualparadox.docalign.application.config;

import eu.virtualparadox.docalign.alphabet.Alphabet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Loads the label alphabet configured under {@code docalign.alphabet}.
 */
@Configuration
@Slf4j
public class AlphabetConfig {

    /**
     * @param props application properties
     * @return alphabet used as the character-permission oracle
     * @throws IOException if the alphabet file cannot be read
     */
    @Bean
    public Alphabet alphabet(final ApplicationConfig props) throws IOException {
        final Alphabet alphabet = Alphabet.load(props.getAlphabet());
        log.info("Loaded alphabet with {} labels from {}", alphabet.size(), alphabet.getSource());
        return alphabet;
    }
}
