package com.postx.pool;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PostxAccountPoolApplication {

    public static void main(String[] args) {
        SpringApplication.run(PostxAccountPoolApplication.class, args);
    }
}
