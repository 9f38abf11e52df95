package com.slack.querier;

import static org.assertj.core.api.Assertions.assertThat;

import com.slack.querier.quorum.QuorumNotReachedException;
import io.grpc.Status;
import java.io.IOException;
import org.junit.jupiter.api.Test;

public class UnimplementedCallsTest {

  @Test
  public void testDetectsUnimplementedStatus() {
    assertThat(UnimplementedCalls.isUnimplementedCallError(Status.UNIMPLEMENTED.asRuntimeException()))
        .isTrue();
    assertThat(UnimplementedCalls.isUnimplementedCallError(Status.UNIMPLEMENTED.asException()))
        .isTrue();
  }

  @Test
  public void testDetectsUnimplementedStatusInCauseChain() {
    QuorumNotReachedException wrapped =
        new QuorumNotReachedException("quorum not reached", Status.UNIMPLEMENTED.asRuntimeException());

    assertThat(UnimplementedCalls.isUnimplementedCallError(wrapped)).isTrue();
  }

  @Test
  public void testOtherErrors() {
    assertThat(UnimplementedCalls.isUnimplementedCallError(null)).isFalse();
    assertThat(UnimplementedCalls.isUnimplementedCallError(Status.UNAVAILABLE.asRuntimeException()))
        .isFalse();
    assertThat(UnimplementedCalls.isUnimplementedCallError(new IOException("unimplemented")))
        .isFalse();
  }
}
