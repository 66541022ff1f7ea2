package com.wordleague.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WordLeagueApplication {

    public static void main(String[] args) {
        SpringApplication.run(WordLeagueApplication.class, args);
    }
}
