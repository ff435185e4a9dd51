package com.neuronplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NeuronConversationApplication {

    public static void main(String[] args) {
        SpringApplication.run(NeuronConversationApplication.class, args);
    }
}
