package com.slack.querier.client;

import static com.slack.querier.client.CachingReplicaClientPool.REPLICA_CLIENTS_CACHED;
import static com.slack.querier.testlib.MetricsUtil.getValue;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class CachingReplicaClientPoolTest {
  private SimpleMeterRegistry meterRegistry;
  private ReplicaClientFactory clientFactory;
  private CachingReplicaClientPool clientPool;

  @BeforeEach
  public void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    clientFactory = mock(ReplicaClientFactory.class);
    clientPool = new CachingReplicaClientPool(clientFactory, meterRegistry);
  }

  @AfterEach
  public void tearDown() {
    if (clientPool.isRunning()) {
      clientPool.stopAsync().awaitTerminated();
    }
    meterRegistry.close();
  }

  @Test
  public void testClientsAreCreatedOncePerAddress() throws IOException {
    ReplicaClient client = mock(ReplicaClient.class);
    when(clientFactory.create("ingester-1:9095")).thenReturn(client);
    clientPool.startAsync().awaitRunning();

    assertThat(clientPool.getClientFor("ingester-1:9095")).isSameAs(client);
    assertThat(clientPool.getClientFor("ingester-1:9095")).isSameAs(client);

    verify(clientFactory, times(1)).create("ingester-1:9095");
    assertThat(clientPool.size()).isEqualTo(1);
    assertThat(getValue(REPLICA_CLIENTS_CACHED, meterRegistry)).isEqualTo(1);
  }

  @Test
  public void testClientCreationFailure() throws IOException {
    IOException cause = new IOException("connection refused");
    when(clientFactory.create("ingester-1:9095")).thenThrow(cause);
    clientPool.startAsync().awaitRunning();

    assertThatExceptionOfType(ReplicaUnavailableException.class)
        .isThrownBy(() -> clientPool.getClientFor("ingester-1:9095"))
        .withCause(cause)
        .matches((e) -> e.getAddress().equals("ingester-1:9095"));
    assertThat(clientPool.size()).isZero();
  }

  @Test
  public void testPoolMustBeRunning() {
    assertThatIllegalStateException().isThrownBy(() -> clientPool.getClientFor("ingester-1:9095"));
  }

  @Test
  public void testEvictAndRemoveStaleClients() throws IOException {
    ReplicaClient first = mock(ReplicaClient.class);
    ReplicaClient second = mock(ReplicaClient.class);
    ReplicaClient third = mock(ReplicaClient.class);
    when(clientFactory.create("a")).thenReturn(first);
    when(clientFactory.create("b")).thenReturn(second);
    when(clientFactory.create("c")).thenReturn(third);
    clientPool.startAsync().awaitRunning();
    clientPool.getClientFor("a");
    clientPool.getClientFor("b");
    clientPool.getClientFor("c");

    clientPool.evict("a");
    verify(first).close();
    assertThat(clientPool.size()).isEqualTo(2);

    assertThat(clientPool.removeStaleClients(Set.of("b"))).isEqualTo(1);
    verify(third).close();
    verify(second, never()).close();
    assertThat(clientPool.size()).isEqualTo(1);
  }

  @Test
  public void testStoppingClosesEveryClient() throws IOException {
    ReplicaClient first = mock(ReplicaClient.class);
    ReplicaClient second = mock(ReplicaClient.class);
    when(clientFactory.create("a")).thenReturn(first);
    when(clientFactory.create("b")).thenReturn(second);
    // a failing close must not stop the other clients from closing
    doThrow(new IOException("already closed")).when(first).close();
    clientPool.startAsync().awaitRunning();
    clientPool.getClientFor("a");
    clientPool.getClientFor("b");

    clientPool.stopAsync().awaitTerminated();

    verify(first).close();
    verify(second).close();
    assertThat(clientPool.size()).isZero();
  }
}
