package com.whereq.modelhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * WhereQ ModelHub - model serving and pipeline orchestration core.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class ModelHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelHubApplication.class, args);
    }
}
