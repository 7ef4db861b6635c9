package com.flamingo.ai.chatstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Resumable chat streaming backend. */
@SpringBootApplication
public class ChatStreamApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChatStreamApplication.class, args);
  }
}
