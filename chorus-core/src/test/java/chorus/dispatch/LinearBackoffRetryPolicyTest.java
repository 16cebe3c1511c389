package chorus.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearBackoffRetryPolicyTest {

  @Test
  void delayGrowsLinearly() {
    var policy = new LinearBackoffRetryPolicy();
    assertEquals(1000, policy.computeDelayMs(1));
    assertEquals(2000, policy.computeDelayMs(2));
    assertEquals(3000, policy.computeDelayMs(3));
  }

  @Test
  void nonPositiveAttemptsHaveNoDelay() {
    var policy = new LinearBackoffRetryPolicy(250);
    assertEquals(0, policy.computeDelayMs(0));
    assertEquals(0, policy.computeDelayMs(-1));
  }

  @Test
  void saturatesInsteadOfOverflowing() {
    var policy = new LinearBackoffRetryPolicy(Long.MAX_VALUE / 2);
    assertEquals(Long.MAX_VALUE, policy.computeDelayMs(3));
  }

  @Test
  void negativeBaseRejected() {
    assertThrows(IllegalArgumentException.class, () -> new LinearBackoffRetryPolicy(-1));
  }
}
