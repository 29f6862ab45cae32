package com.motaz.triage;

import com.redis.om.spring.annotations.EnableRedisDocumentRepositories;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;


@SpringBootApplication
@EnableRedisDocumentRepositories
public class TriageApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageApiApplication.class, args);
    }

}
