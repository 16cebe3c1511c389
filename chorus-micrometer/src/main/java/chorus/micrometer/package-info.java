/**
 * Micrometer bridge for {@link chorus.spi.MetricsExporter}.
 *
 * @see chorus.micrometer.MicrometerMetricsExporter
 */
package chorus.micrometer;
