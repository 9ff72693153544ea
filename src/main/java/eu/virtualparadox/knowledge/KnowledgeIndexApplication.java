package eu.virtualparadox.knowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KnowledgeIndexApplication {

    public static void main(final String[] args) {
        SpringApplication.run(KnowledgeIndexApplication.class, args);
    }
}
