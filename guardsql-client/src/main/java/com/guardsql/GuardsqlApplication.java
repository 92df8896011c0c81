package com.guardsql;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.guardsql.model.SessionContext;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GuardsqlApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GuardsqlApplication.class, args)));
    }

    @Bean
    public SessionContext sessionContext() {
        return new SessionContext();
    }

    /**
     * Boot only auto-configures a mapper alongside spring-web, which this client does not carry.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
