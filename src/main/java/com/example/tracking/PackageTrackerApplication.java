package com.example.tracking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Package Tracker Application.
 *
 * Keeps a durable local record per tracking number, reconciles it against the
 * carrier aggregation API and accepts push notifications from that API.
 */
@SpringBootApplication
public class PackageTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PackageTrackerApplication.class, args);
    }
}
