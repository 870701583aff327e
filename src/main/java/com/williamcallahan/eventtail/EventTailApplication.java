package com.williamcallahan.eventtail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EventTailApplication {

    public static void main(String[] args) {
        // Disable Netty native OpenSSL (tcnative) to avoid Alpine musl segfaults
        System.setProperty("io.netty.handler.ssl.noOpenSsl", "true");
        int exitCode = SpringApplication.exit(SpringApplication.run(EventTailApplication.class, args));
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
