package com.example.progress.notifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Workflow Progress Notifier.
 *
 * Clients hold a WebSocket open on /ws/{clientId}; research workflows submitted over REST walk
 * their stages in the background and every stage transition is pushed to all connected clients.
 */
@SpringBootApplication(scanBasePackages = "com.example.progress")
@EnableScheduling
public class ProgressNotifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProgressNotifierApplication.class, args);
    }
}
