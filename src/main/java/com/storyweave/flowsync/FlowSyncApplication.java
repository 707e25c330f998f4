package com.storyweave.flowsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowSyncApplication.class, args);
    }
}
