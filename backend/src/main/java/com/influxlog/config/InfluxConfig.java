package com.influxlog.config;

import com.influxdb.client.InfluxDBClient;
import com.influxdb.client.InfluxDBClientFactory;
import com.influxdb.client.QueryApi;
import com.influxdb.client.WriteApiBlocking;
import com.influxlog.logging.InfluxLogAppender;
import com.influxlog.logging.InfluxLogging;
import com.influxlog.logging.LogPointMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(InfluxProperties.class)
public class InfluxConfig {

    @Bean(destroyMethod = "close")
    public InfluxDBClient influxDBClient(InfluxProperties properties) {
        log.info("Connecting to InfluxDB: url={}, org={}, bucket={}",
                properties.getUrl(), properties.getOrg(), properties.getBucket());
        return InfluxDBClientFactory.create(
                properties.getUrl(),
                properties.getToken().toCharArray(),
                properties.getOrg(),
                properties.getBucket());
    }

    @Bean
    public QueryApi queryApi(InfluxDBClient client) {
        return client.getQueryApi();
    }

    @Bean
    public WriteApiBlocking writeApiBlocking(InfluxDBClient client) {
        return client.getWriteApiBlocking();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(prefix = "influx.appender", name = "enabled", havingValue = "true")
    public InfluxLogging influxLogging(WriteApiBlocking writeApi, LogPointMapper pointMapper,
                                       InfluxProperties properties) {
        InfluxLogAppender appender = new InfluxLogAppender(
                writeApi, pointMapper, properties.getBucket(), properties.getOrg());
        return new InfluxLogging(appender);
    }
}
