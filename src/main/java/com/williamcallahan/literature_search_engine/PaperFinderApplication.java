/**
 * Main application class for Paper Finder
 *
 * @author William Callahan
 *
 * Features:
 * - Loads a local .env file before Spring reads its environment
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.literature_search_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

@SpringBootApplication
public class PaperFinderApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        loadDotEnvFile();
        SpringApplication.run(PaperFinderApplication.class, args);
    }

    private static void loadDotEnvFile() {
        Path envFile = Paths.get(".env");
        if (!Files.exists(envFile)) {
            return;
        }
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(envFile)) {
            props.load(is);
        } catch (IOException | SecurityException e) {
            // logging is not configured yet
            System.err.println("Could not read .env file: " + e.getMessage());
            return;
        }
        // Set as system properties only if not already set as environment variables
        for (String key : props.stringPropertyNames()) {
            if (System.getenv(key) == null) {
                System.setProperty(key, props.getProperty(key));
            }
        }
    }
}
