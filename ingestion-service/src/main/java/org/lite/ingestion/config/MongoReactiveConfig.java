package org.lite.ingestion.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.ReactiveMongoDatabaseFactory;
import org.springframework.data.mongodb.config.AbstractReactiveMongoConfiguration;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.core.mapping.MongoMappingContext;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;
import org.springframework.lang.NonNull;

import java.util.concurrent.TimeUnit;

/**
 * Queue, job and index collections. The database comes from the connection string unless
 * {@code spring.data.mongodb.database} names one.
 */
@Configuration
@EnableReactiveMongoRepositories(basePackages = "org.lite.ingestion.repository")
@EnableReactiveMongoAuditing
@Slf4j
public class MongoReactiveConfig extends AbstractReactiveMongoConfiguration {

    private final ConnectionString connectionString;
    private final String database;

    public MongoReactiveConfig(@Value("${spring.data.mongodb.uri}") String uri,
                               @Value("${spring.data.mongodb.database:}") String database) {
        this.connectionString = new ConnectionString(uri);
        this.database = !database.isBlank() ? database
                : connectionString.getDatabase() != null ? connectionString.getDatabase() : "contract_ingestion";
    }

    @Override
    protected @NonNull String getDatabaseName() {
        return database;
    }

    @Override
    @Bean
    public @NonNull MongoClient reactiveMongoClient() {
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(connectionString)
                .applicationName("ingestion-service")
                .applyToClusterSettings(cluster -> cluster.serverSelectionTimeout(10, TimeUnit.SECONDS))
                .build();
        log.info("🗄️ Queue and index store: database '{}' on {}", database, connectionString.getHosts());
        return MongoClients.create(settings);
    }

    // Queue entry and job indexes are declared on the entities
    @Override
    protected boolean autoIndexCreation() {
        return true;
    }

    @Bean
    @Override
    public @NonNull MappingMongoConverter mappingMongoConverter(
            @NonNull ReactiveMongoDatabaseFactory databaseFactory,
            @NonNull MongoCustomConversions customConversions,
            @NonNull MongoMappingContext mappingContext) {
        MappingMongoConverter converter = super.mappingMongoConverter(databaseFactory, customConversions, mappingContext);
        // IndexedDocument.metadata is an open map; dotted keys from callers are stored with "_"
        converter.setMapKeyDotReplacement("_");
        return converter;
    }
}
