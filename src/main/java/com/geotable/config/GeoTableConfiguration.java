package com.geotable.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.geotable.config.serializer.GeometryDeserializer;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.io.WKTReader;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Application configuration for the geo table
 */
@Configuration
@EnableConfigurationProperties(GeoTableProperties.class)
public class GeoTableConfiguration {

    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory();
    }

    @Bean
    public WKTReader wktReader(GeometryFactory geometryFactory) {
        return new WKTReader(geometryFactory);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Item positions are decimals; keep them exact
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

        SimpleModule geometryModule = new SimpleModule();
        geometryModule.addDeserializer(Geometry.class, new GeometryDeserializer());
        mapper.registerModule(geometryModule);

        return mapper;
    }

    /**
     * Pool running the per-cell range queries of a page
     */
    @Bean(name = "geoQueryExecutor")
    public ThreadPoolTaskExecutor geoQueryExecutor(GeoTableProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getQueryThreads());
        executor.setMaxPoolSize(properties.getQueryThreads());
        executor.setQueueCapacity(properties.getMaxCellsPerQuery() * 4);
        executor.setThreadNamePrefix("geo-query-");
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);
        // A full queue makes the requesting thread run the range query itself
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
