package com.dwh.pipeline;

import com.dwh.pipeline.config.PipelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PipelineProperties.class)
public class SalesDwhPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesDwhPipelineApplication.class, args);
    }
}
