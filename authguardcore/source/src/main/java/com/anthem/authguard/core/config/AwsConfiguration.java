package com.anthem.authguard.core.config;

import com.anthem.authguard.core.AuthGuardProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;

/**
 * AWS client configuration.
 * The {@code local} profile points S3 at a LocalStack endpoint with static credentials.
 */
@Configuration
@EnableConfigurationProperties(AuthGuardProperties.class)
public class AwsConfiguration {

    @Bean
    public S3Client s3Client(AuthGuardProperties properties) {
        return S3Client.builder()
                .region(Region.of(properties.getAws().getRegion()))
                .build();
    }

    @Configuration
    @Profile({"local", "docker"})
    static class LocalAws {

        @Bean
        @Primary
        public S3Client localS3Client(AuthGuardProperties properties) {
            String endpoint = properties.getAws().getEndpoint();
            if (endpoint == null || endpoint.isEmpty()) {
                endpoint = "http://localhost:4566";
            }
            return S3Client.builder()
                    .endpointOverride(URI.create(endpoint))
                    .region(Region.of(properties.getAws().getRegion()))
                    .credentialsProvider(StaticCredentialsProvider.create(
                            AwsBasicCredentials.create("test", "test")))
                    .forcePathStyle(true)
                    .build();
        }
    }
}
