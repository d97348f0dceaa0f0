package io.github.hotbrkm.spfengine.evaluator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@Slf4j
@SpringBootApplication(scanBasePackages = {"io.github.hotbrkm.spfengine.evaluator"})
public class EvaluatorApplication {

    private static final String PROFILE_PROPERTY = "spring.profiles.active";
    private static final String DEFAULT_PROFILE = "default";

    public static void main(String[] args) {
        String profile = System.getProperty(PROFILE_PROPERTY, DEFAULT_PROFILE);

        log.info("Starting Evaluator with profile: {}", profile);

        new SpringApplicationBuilder(EvaluatorApplication.class)
                .profiles(profile)
                .web(WebApplicationType.NONE)
                .run(args);
    }
}
