package com.teachertraining.api.config;

import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;
import org.springframework.data.mongodb.core.convert.MongoConverter;

/**
 * Single process-wide MongoDB handle shared by every request.
 * Connection string and database name come from DATABASE_URL / DATABASE_NAME
 * through application.yml.
 */
@Configuration
@EnableConfigurationProperties(TrainingApiProperties.class)
public class MongoConfig {

    private final String mongoUri;
    private final String databaseName;

    public MongoConfig(
        @Value("${spring.data.mongodb.uri:mongodb://localhost:27017}") String mongoUri,
        @Value("${spring.data.mongodb.database:teacher_training}") String databaseName) {
            this.mongoUri = mongoUri;
            this.databaseName = databaseName;
    }

    @Bean
    public MongoClient mongoClient() {
        return MongoClients.create(mongoUri);
    }

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(MongoClient mongoClient) {
        return new SimpleMongoClientDatabaseFactory(mongoClient, databaseName);
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoDatabaseFactory mongoDatabaseFactory, MongoConverter mongoConverter) {
        return new MongoTemplate(mongoDatabaseFactory, mongoConverter);
    }
}
