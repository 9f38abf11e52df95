package com.slack.querier.ring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.util.List;
import org.junit.jupiter.api.Test;

public class ReplicaSetTest {

  @Test
  public void testMajorityQuorum() {
    assertThat(ReplicaSet.of(List.of(ReplicaDescriptor.active("a"))).maxErrors).isZero();
    assertThat(
            ReplicaSet.of(List.of(ReplicaDescriptor.active("a"), ReplicaDescriptor.active("b")))
                .maxErrors)
        .isZero();
    assertThat(
            ReplicaSet.of(
                    List.of(
                        ReplicaDescriptor.active("a"),
                        ReplicaDescriptor.active("b"),
                        ReplicaDescriptor.active("c")))
                .maxErrors)
        .isEqualTo(1);
    assertThat(ReplicaSet.of(List.of()).isEmpty()).isTrue();
  }

  @Test
  public void testInvalidBudgets() {
    List<ReplicaDescriptor> replicas =
        List.of(ReplicaDescriptor.active("a", "z1"), ReplicaDescriptor.active("b", "z2"));

    assertThatIllegalArgumentException().isThrownBy(() -> new ReplicaSet(replicas, 1, 1));
    assertThatIllegalArgumentException().isThrownBy(() -> new ReplicaSet(replicas, 2, 0));
    assertThatIllegalArgumentException().isThrownBy(() -> new ReplicaSet(replicas, -1, 0));
  }

  @Test
  public void testReplicasByZone() {
    ReplicaSet replicaSet =
        new ReplicaSet(
            List.of(
                ReplicaDescriptor.active("b1", "zone-b"),
                ReplicaDescriptor.active("a1", "zone-a"),
                ReplicaDescriptor.active("b2", "zone-b"),
                ReplicaDescriptor.active("x")),
            0,
            1);

    assertThat(replicaSet.isZoneAware()).isTrue();
    assertThat(replicaSet.replicasByZone()).containsOnlyKeys("zone-b", "zone-a", "");
    assertThat(replicaSet.replicasByZone().keySet()).containsExactly("zone-b", "zone-a", "");
    assertThat(replicaSet.replicasByZone().get("zone-b"))
        .extracting((r) -> r.address)
        .containsExactly("b1", "b2");
  }

  @Test
  public void testFilter() {
    ReplicaSet replicaSet =
        ReplicaSet.of(
            List.of(
                ReplicaDescriptor.active("a"),
                new ReplicaDescriptor("b", null, ReplicaState.LEAVING),
                ReplicaDescriptor.active("c")));

    ReplicaSet active = replicaSet.filter(ReplicaDescriptor::isActive, 0);

    assertThat(active.replicas).extracting((r) -> r.address).containsExactly("a", "c");
    assertThat(active.maxErrors).isZero();
  }
}
