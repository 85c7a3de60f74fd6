package io.invoicemart.marketplace.config;

import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
@ConditionalOnProperty(
    name = "marketplace.storage.provider",
    havingValue = "s3",
    matchIfMissing = true)
@EnableConfigurationProperties({
  S3Config.S3Properties.class,
  S3Config.AwsCredentialsProperties.class
})
public class S3Config {

  @ConfigurationProperties("aws.s3")
  public record S3Properties(String endpoint, String region, String bucketName) {

    boolean hasEndpointOverride() {
      return endpoint != null && !endpoint.isBlank();
    }
  }

  @ConfigurationProperties("aws.credentials")
  public record AwsCredentialsProperties(String accessKeyId, String secretAccessKey) {}

  @Bean(destroyMethod = "close")
  S3Client s3Client(S3Properties s3Props, AwsCredentialsProperties credProps) {
    var builder =
        S3Client.builder()
            .region(Region.of(s3Props.region()))
            .credentialsProvider(credentials(s3Props, credProps));
    if (s3Props.hasEndpointOverride()) {
      builder
          .endpointOverride(URI.create(s3Props.endpoint()))
          .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  S3Presigner s3Presigner(S3Properties s3Props, AwsCredentialsProperties credProps) {
    var builder =
        S3Presigner.builder()
            .region(Region.of(s3Props.region()))
            .credentialsProvider(credentials(s3Props, credProps));
    if (s3Props.hasEndpointOverride()) {
      builder
          .endpointOverride(URI.create(s3Props.endpoint()))
          .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
    }
    return builder.build();
  }

  // Static credentials only for local S3-compatible endpoints (LocalStack, MinIO).
  private static AwsCredentialsProvider credentials(
      S3Properties s3Props, AwsCredentialsProperties credProps) {
    if (s3Props.hasEndpointOverride() && credProps.accessKeyId() != null) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(credProps.accessKeyId(), credProps.secretAccessKey()));
    }
    return DefaultCredentialsProvider.create();
  }
}
