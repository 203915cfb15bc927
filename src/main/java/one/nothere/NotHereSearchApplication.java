/**
 * Main application class for the NotHere.one crawler and scoring engine
 *
 * Features:
 * - Non-web Spring Boot process driven by command-line runners
 * - Loads an optional .env file before the context starts
 * - Exits with the status reported by the runners
 */

package one.nothere;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class NotHereSearchApplication {

    private static final Logger log = LoggerFactory.getLogger(NotHereSearchApplication.class);

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        System.exit(SpringApplication.exit(SpringApplication.run(NotHereSearchApplication.class, args)));
    }

    /**
     * Time source for crawl timestamps and score ageing.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static void loadDotEnvFile() {
        try {
            Path envFile = Paths.get(".env");
            if (Files.exists(envFile)) {
                Properties props = new Properties();
                try (InputStream is = Files.newInputStream(envFile)) {
                    props.load(is);
                }
                // Real environment variables win over .env entries
                for (String key : props.stringPropertyNames()) {
                    if (System.getenv(key) == null) {
                        System.setProperty(key, props.getProperty(key));
                    }
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}
