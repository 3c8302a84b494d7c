package eu.virtualparadox.docalign;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocAlignApplication {

    public static void main(final String[] args) {
        SpringApplication.run(DocAlignApplication.class, args);
    }
}
