package com.example.audiobook;

import com.example.audiobook.config.PipelineConfiguration;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

@Configuration
@Import({
        PipelineConfiguration.class
})
@ComponentScan({
        "com.example.audiobook.service"
})
public class AutoConfiguration {
}
