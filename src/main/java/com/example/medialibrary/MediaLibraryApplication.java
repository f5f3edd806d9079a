package com.example.medialibrary;

import com.example.medialibrary.common.config.AppLibraryProperties;
import com.example.medialibrary.common.config.AppSyncProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.medialibrary.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppSyncProperties.class,
        AppLibraryProperties.class
})
public class MediaLibraryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaLibraryApplication.class, args);
    }
}
