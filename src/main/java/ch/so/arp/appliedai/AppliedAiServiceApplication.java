package ch.so.arp.appliedai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AppliedAiServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AppliedAiServiceApplication.class, args);
    }
}
