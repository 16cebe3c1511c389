package chorus.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the broadcast engine.
 *
 * @see ChorusAutoConfiguration
 */
@ConfigurationProperties(prefix = "chorus")
public class ChorusProperties {

  private final Engine engine = new Engine();
  private final Retry retry = new Retry();
  private final Reactions reactions = new Reactions();
  private final Digest digest = new Digest();
  private final Metrics metrics = new Metrics();

  public Engine getEngine() {
    return engine;
  }

  public Retry getRetry() {
    return retry;
  }

  public Reactions getReactions() {
    return reactions;
  }

  public Digest getDigest() {
    return digest;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Engine {
    private int workerCount = 10;
    private int maxAttempts = 3;
    private Duration recipientTimeout = Duration.ofSeconds(30);

    public int getWorkerCount() {
      return workerCount;
    }

    public void setWorkerCount(int workerCount) {
      this.workerCount = workerCount;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getRecipientTimeout() {
      return recipientTimeout;
    }

    public void setRecipientTimeout(Duration recipientTimeout) {
      this.recipientTimeout = recipientTimeout;
    }
  }

  public static class Retry {
    /**
     * Delay before attempt {@code n + 1} is {@code baseDelayMs * n}.
     */
    private long baseDelayMs = 1000;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }
  }

  public static class Reactions {
    /**
     * How far back a reaction may look for its target broadcast.
     */
    private Duration lookback = Duration.ofHours(24);
    /**
     * Re-send the summary every N active reactions.
     */
    private int updateEvery = 3;
    /**
     * Re-send the summary when it has not been sent for this long.
     */
    private Duration quietInterval = Duration.ofMinutes(5);

    public Duration getLookback() {
      return lookback;
    }

    public void setLookback(Duration lookback) {
      this.lookback = lookback;
    }

    public int getUpdateEvery() {
      return updateEvery;
    }

    public void setUpdateEvery(int updateEvery) {
      this.updateEvery = updateEvery;
    }

    public Duration getQuietInterval() {
      return quietInterval;
    }

    public void setQuietInterval(Duration quietInterval) {
      this.quietInterval = quietInterval;
    }
  }

  public static class Digest {
    private boolean enabled = true;
    private Duration pauseDelay = Duration.ofMinutes(30);
    private Duration pauseWindow = Duration.ofHours(2);
    /**
     * Local time of the daily digest, {@code HH:mm}.
     */
    private String dailyTime = "20:00";
    private int dailyTopN = 5;
    /**
     * Zone for the daily digest. Defaults to the system zone.
     */
    private String zone;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getPauseDelay() {
      return pauseDelay;
    }

    public void setPauseDelay(Duration pauseDelay) {
      this.pauseDelay = pauseDelay;
    }

    public Duration getPauseWindow() {
      return pauseWindow;
    }

    public void setPauseWindow(Duration pauseWindow) {
      this.pauseWindow = pauseWindow;
    }

    public String getDailyTime() {
      return dailyTime;
    }

    public void setDailyTime(String dailyTime) {
      this.dailyTime = dailyTime;
    }

    public int getDailyTopN() {
      return dailyTopN;
    }

    public void setDailyTopN(int dailyTopN) {
      this.dailyTopN = dailyTopN;
    }

    public String getZone() {
      return zone;
    }

    public void setZone(String zone) {
      this.zone = zone;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "chorus";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
