package br.com.analytics.pipeline.device_lifecycle_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;

@Configuration
public class DataSourceConfig {

    private final Environment env;

    public DataSourceConfig(Environment env) {
        this.env = env;
    }

    @Bean(name = "appDataSource")
    public DataSource appDataSource() {
        return pool("app");
    }

    @Bean(name = "batchDataSource")
    @Primary
    public DataSource batchDataSource() {
        return pool("batch");
    }

    @Bean(name = {"batchTransactionManager", "transactionManager"})
    @Primary
    public DataSourceTransactionManager batchTransactionManager(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

    private HikariDataSource pool(String name) {
        String prefix = "spring.datasource." + name + ".";
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName(name + "-pool");
        dataSource.setDriverClassName(env.getProperty(prefix + "driver-class-name"));
        dataSource.setJdbcUrl(env.getProperty(prefix + "url"));
        dataSource.setUsername(env.getProperty(prefix + "username"));
        dataSource.setPassword(env.getProperty(prefix + "password"));
        return dataSource;
    }
}
