package com.github.stormino.vimeocrawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VimeoCrawlerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(VimeoCrawlerApplication.class, args)));
    }
}
