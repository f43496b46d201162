package com.example.iptvcatalog;

import com.example.iptvcatalog.common.config.AppPlaylistFetchProperties;
import com.example.iptvcatalog.common.config.AppSyncProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.iptvcatalog.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppSyncProperties.class,
        AppPlaylistFetchProperties.class
})
public class IptvCatalogApplication {

    public static void main(String[] args) {
        SpringApplication.run(IptvCatalogApplication.class, args);
    }
}
