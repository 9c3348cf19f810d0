package com.hcpbridge.leadwebhook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeadWebhookApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeadWebhookApplication.class, args);
    }
}
