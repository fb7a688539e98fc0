package com.onyx.downloader;

import com.onyx.downloader.config.DownloadProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DownloadProperties.class)
public class OnyxDownloaderApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(OnyxDownloaderApplication.class, args)));
    }
}
