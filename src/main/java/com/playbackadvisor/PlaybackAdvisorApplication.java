package com.playbackadvisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PlaybackAdvisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlaybackAdvisorApplication.class, args);
    }
}
