package com.astmutator.config;

import com.astmutator.parser.JavaSourceParser;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(MutatorProperties.class)
public class MutatorConfiguration {

    @Bean
    public JavaSourceParser javaSourceParser(MutatorProperties properties) {
        return new JavaSourceParser(properties.getLanguageLevel());
    }
}
