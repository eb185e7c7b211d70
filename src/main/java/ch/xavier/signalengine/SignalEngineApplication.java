package ch.xavier.signalengine;

import ch.xavier.signalengine.config.SignalEngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SignalEngineProperties.class)
public class SignalEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalEngineApplication.class, args);
    }
}
