package chorus.spring.boot;

import chorus.micrometer.MicrometerMetricsExporter;
import chorus.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code chorus.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link ChorusAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the {@link chorus.Chorus} composite.
 */
@AutoConfiguration(before = ChorusAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "chorus.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ChorusProperties.class)
public class ChorusMicrometerAutoConfiguration {

  /** Closed by {@link chorus.Chorus#close()} when the composite shuts down. */
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, ChorusProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
