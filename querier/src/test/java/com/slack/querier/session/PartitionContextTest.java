package com.slack.querier.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.slack.querier.client.ReplicaClient;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class PartitionContextTest {

  private static List<String> addresses(PartitionContext partitionContext) {
    return partitionContext.usedReplicas().stream()
        .map(PartitionContext.UsedReplica::address)
        .collect(Collectors.toList());
  }

  @Test
  public void testNothingIsRecordedUntilPartitioned() {
    PartitionContext partitionContext = new PartitionContext();
    partitionContext.addClient(mock(ReplicaClient.class), "a");

    assertThat(partitionContext.isPartitioned()).isFalse();
    assertThat(partitionContext.usedReplicas()).isEmpty();
  }

  @Test
  public void testAddAndRemoveClients() {
    ReplicaClient clientA = mock(ReplicaClient.class);
    ReplicaClient clientB = mock(ReplicaClient.class);
    PartitionContext partitionContext = new PartitionContext();
    partitionContext.setPartitioned(true);

    partitionContext.addClient(clientA, "a");
    partitionContext.addClient(clientB, "b");
    assertThat(addresses(partitionContext)).containsExactlyInAnyOrder("a", "b");

    partitionContext.removeClient("a");
    assertThat(partitionContext.usedReplicas())
        .containsExactly(new PartitionContext.UsedReplica(clientB, "b"));

    // removing an address that was never recorded is a no-op
    partitionContext.removeClient("c");
    assertThat(addresses(partitionContext)).containsExactly("b");
  }

  @Test
  public void testSameAddressIsRecordedOnce() {
    PartitionContext partitionContext = new PartitionContext();
    partitionContext.setPartitioned(true);
    ReplicaClient client = mock(ReplicaClient.class);

    partitionContext.addClient(client, "a");
    partitionContext.addClient(client, "a");

    assertThat(addresses(partitionContext)).containsExactly("a");
  }

  @Test
  public void testUsedReplicasIsASnapshot() {
    PartitionContext partitionContext = new PartitionContext();
    partitionContext.setPartitioned(true);
    partitionContext.addClient(mock(ReplicaClient.class), "a");

    List<PartitionContext.UsedReplica> snapshot = partitionContext.usedReplicas();
    partitionContext.addClient(mock(ReplicaClient.class), "b");

    assertThat(snapshot).hasSize(1);
    assertThat(partitionContext.usedReplicas()).hasSize(2);
  }

  @Test
  public void testRemoveIsIgnoredOnceNoLongerPartitioned() {
    PartitionContext partitionContext = new PartitionContext();
    partitionContext.setPartitioned(true);
    partitionContext.addClient(mock(ReplicaClient.class), "a");
    partitionContext.setPartitioned(false);

    partitionContext.removeClient("a");

    assertThat(addresses(partitionContext)).containsExactly("a");
  }
}
