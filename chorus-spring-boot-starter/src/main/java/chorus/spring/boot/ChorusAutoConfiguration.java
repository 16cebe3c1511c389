package chorus.spring.boot;

import chorus.Chorus;
import chorus.InboundMessageHandler;
import chorus.dispatch.LinearBackoffRetryPolicy;
import chorus.jdbc.directory.JdbcRecipientDirectory;
import chorus.jdbc.ledger.AbstractJdbcMessageLedger;
import chorus.jdbc.ledger.JdbcMessageLedgers;
import chorus.reaction.DefaultUpdateTimingPolicy;
import chorus.reaction.UpdateTimingPolicy;
import chorus.spi.BlobStore;
import chorus.spi.MessageLedger;
import chorus.spi.MetricsExporter;
import chorus.spi.RecipientDirectory;
import chorus.spi.Transport;
import chorus.transport.LoggingTransport;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Auto-configuration for the broadcast engine.
 *
 * <p>Wires a {@link Chorus} composite from a {@link DataSource} and {@link ChorusProperties}.
 * Without a {@link Transport} bean, outgoing messages are only logged.
 *
 * @see ChorusProperties
 * @see ChorusMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Chorus.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(ChorusProperties.class)
public class ChorusAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(MessageLedger.class)
  public AbstractJdbcMessageLedger messageLedger(DataSource dataSource) {
    return JdbcMessageLedgers.detect(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(RecipientDirectory.class)
  public JdbcRecipientDirectory recipientDirectory(DataSource dataSource) {
    return JdbcRecipientDirectory.of(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(Transport.class)
  public LoggingTransport transport() {
    return new LoggingTransport();
  }

  @Bean
  @ConditionalOnMissingBean(UpdateTimingPolicy.class)
  public DefaultUpdateTimingPolicy updateTimingPolicy(ChorusProperties props) {
    return new DefaultUpdateTimingPolicy(
        props.getReactions().getUpdateEvery(), props.getReactions().getQuietInterval());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Chorus chorus(ChorusProperties props,
      RecipientDirectory directory,
      MessageLedger ledger,
      Transport transport,
      UpdateTimingPolicy timingPolicy,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<BlobStore> blobStoreProvider) {

    ChorusProperties.Engine engine = props.getEngine();
    ChorusProperties.Digest digest = props.getDigest();
    Chorus.Builder builder = Chorus.builder()
        .directory(directory)
        .ledger(ledger)
        .transport(transport)
        .retryPolicy(new LinearBackoffRetryPolicy(props.getRetry().getBaseDelayMs()))
        .maxAttempts(engine.getMaxAttempts())
        .workerCount(engine.getWorkerCount())
        .recipientTimeout(engine.getRecipientTimeout())
        .timingPolicy(timingPolicy)
        .lookback(props.getReactions().getLookback())
        .digestEnabled(digest.isEnabled())
        .pauseDelay(digest.getPauseDelay())
        .pauseWindow(digest.getPauseWindow())
        .dailyTime(LocalTime.parse(digest.getDailyTime()))
        .dailyTopN(digest.getDailyTopN());
    if (digest.getZone() != null && !digest.getZone().isEmpty()) {
      builder.zone(ZoneId.of(digest.getZone()));
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    BlobStore blobStore = blobStoreProvider.getIfAvailable();
    if (blobStore != null) {
      builder.blobStore(blobStore);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public InboundMessageHandler inboundMessageHandler(Chorus chorus) {
    return chorus.handler();
  }
}
