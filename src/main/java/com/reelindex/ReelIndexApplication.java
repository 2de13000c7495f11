package com.reelindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.File;

@SpringBootApplication
public class ReelIndexApplication {

    private static final Logger log = LoggerFactory.getLogger(ReelIndexApplication.class);

    public static void main(String[] args) {
        // The H2 file database and poster store live under ./data
        ensureDirectories();
        SpringApplication.run(ReelIndexApplication.class, args);
        log.info("ReelIndex started. API available under /api");
    }

    private static void ensureDirectories() {
        String[] dirs = {
                "./data", "./data/db", "./data/models", "./data/posters", "./data/thumbs", "./data/logs"
        };
        for (String dir : dirs) {
            File f = new File(dir);
            if (!f.exists()) {
                f.mkdirs();
            }
        }
    }
}
