package fr.imt.launchpad.launchpad;

import fr.imt.launchpad.launchpad.presentation.cli.PipelineCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
@EnableRetry
public class LaunchpadApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(LaunchpadApplication.class, args);

        // A one-shot CLI run ends the process with the run's exit code.
        if (!context.getBeansOfType(PipelineCommandLineRunner.class).isEmpty()) {
            System.exit(SpringApplication.exit(context));
        }
    }

}
