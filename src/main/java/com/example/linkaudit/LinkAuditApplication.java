package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class LinkAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkAuditApplication.class, args);
        log.info("docx link audit started");
    }
}
