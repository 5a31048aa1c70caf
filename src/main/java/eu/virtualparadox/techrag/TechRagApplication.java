package eu.virtualparadox.techrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TechRagApplication {

    public static void main(final String[] args) {
        SpringApplication.run(TechRagApplication.class, args);
    }
}
