package dev.jobmatcher;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class JobMatcherApplication implements CommandLineRunner {

    private final StartupReporter startupReporter;

    public static void main(String[] args) {
        SpringApplication.run(JobMatcherApplication.class, args);
    }

    @Override
    public void run(String... args) {
        startupReporter.report();
    }
}
