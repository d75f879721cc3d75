package com.enterprise.sheetconvert.config;

import com.enterprise.sheetconvert.extraction.ocr.TextRecognizer;
import com.enterprise.sheetconvert.extraction.ocr.TextractTextRecognizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;
import software.amazon.awssdk.services.textract.TextractClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * AWS SDK clients. Credentials come from the default provider chain; an endpoint
 * override points every client at a local emulator.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String region;

    @Value("${aws.endpoint-override:}")
    private String endpointOverride;

    @Value("${aws.textract.timeout:PT30S}")
    private Duration textractTimeout;

    @Bean(destroyMethod = "close")
    public S3Client s3Client() {
        S3ClientBuilder builder = S3Client.builder().region(Region.of(region));
        if (hasEndpointOverride()) {
            builder.endpointOverride(URI.create(endpointOverride)).forcePathStyle(true);
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner() {
        S3Presigner.Builder builder = S3Presigner.builder().region(Region.of(region));
        if (hasEndpointOverride()) {
            builder.endpointOverride(URI.create(endpointOverride));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "conversion.store", havingValue = "dynamodb", matchIfMissing = true)
    public DynamoDbClient dynamoDbClient() {
        DynamoDbClientBuilder builder = DynamoDbClient.builder().region(Region.of(region));
        if (hasEndpointOverride()) {
            builder.endpointOverride(URI.create(endpointOverride));
        }
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(name = "conversion.extraction.recognition-enabled", havingValue = "true", matchIfMissing = true)
    public TextractClient textractClient() {
        TextractClientBuilder builder = TextractClient.builder()
                .region(Region.of(region))
                .overrideConfiguration(c -> c.apiCallTimeout(textractTimeout));
        if (hasEndpointOverride()) {
            builder.endpointOverride(URI.create(endpointOverride));
        }
        log.info("Textract recognition enabled in {} (timeout {})", region, textractTimeout);
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "conversion.extraction.recognition-enabled", havingValue = "true", matchIfMissing = true)
    public TextRecognizer textRecognizer(TextractClient textractClient) {
        return new TextractTextRecognizer(textractClient);
    }

    private boolean hasEndpointOverride() {
        return endpointOverride != null && !endpointOverride.isBlank();
    }
}
