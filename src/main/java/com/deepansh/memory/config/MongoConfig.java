package com.deepansh.memory.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Mongo transactions for the store's multi-document writes (supersede flips
 * one record and inserts another). Requires a replica set or Atlas; a
 * standalone mongod rejects transactions, so use memory.store.backend=in-memory
 * for local runs without one.
 */
@Configuration
@EnableTransactionManagement
@ConditionalOnProperty(name = "memory.store.backend", havingValue = "mongo", matchIfMissing = true)
public class MongoConfig {

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }
}
