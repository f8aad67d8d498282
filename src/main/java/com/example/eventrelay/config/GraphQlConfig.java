package com.example.eventrelay.config;

import com.example.eventrelay.graphql.SubscriptionSchemaFactory;
import graphql.GraphQL;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GraphQlConfig {

    @Bean
    public GraphQL graphQL(SubscriptionSchemaFactory schemaFactory) {
        return schemaFactory.createGraphQL();
    }
}
