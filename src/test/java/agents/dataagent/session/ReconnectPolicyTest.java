package agents.dataagent.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectPolicyTest {

  @Test
  void testAttemptsAreBounded() {
    ReconnectPolicy policy = new ReconnectPolicy(5000, 2);

    assertTrue(policy.nextAttempt());
    assertTrue(policy.nextAttempt());
    assertFalse(policy.nextAttempt());
    assertTrue(policy.isExhausted());
    assertEquals(2, policy.getAttempts());
  }

  @Test
  void testResetAfterSuccessfulConnect() {
    ReconnectPolicy policy = new ReconnectPolicy(5000, 1);
    policy.nextAttempt();
    policy.reset();

    assertFalse(policy.isExhausted());
    assertTrue(policy.nextAttempt());
  }

  @Test
  void testDisabledPolicyNeverRetries() {
    ReconnectPolicy policy = new ReconnectPolicy(5000, 10);
    policy.disable();

    assertFalse(policy.nextAttempt());
    assertEquals(0, policy.getAttempts());

    policy.enable();
    assertTrue(policy.nextAttempt());
  }

  @Test
  void testZeroAttemptsMeansNoReconnect() {
    assertFalse(new ReconnectPolicy(100, 0).nextAttempt());
  }
}
