package com.slack.querier.client;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.util.concurrent.AbstractIdleService;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one client per ingester address. Clients are created lazily on first use and closed when
 * they are evicted or when the pool stops.
 */
public class CachingReplicaClientPool extends AbstractIdleService implements ReplicaClientPool {
  private static final Logger LOG = LoggerFactory.getLogger(CachingReplicaClientPool.class);

  public static final String REPLICA_CLIENTS_CACHED = "ingester_clients_cached";

  private final ReplicaClientFactory clientFactory;
  private final Map<String, ReplicaClient> clients = new ConcurrentHashMap<>();

  public CachingReplicaClientPool(ReplicaClientFactory clientFactory, MeterRegistry meterRegistry) {
    this.clientFactory = clientFactory;
    meterRegistry.gaugeMapSize(REPLICA_CLIENTS_CACHED, List.of(), clients);
  }

  @Override
  public ReplicaClient getClientFor(String address) {
    checkState(isRunning(), "Client pool is not running, state=%s", state());
    ReplicaClient client = clients.get(address);
    if (client != null) {
      return client;
    }

    try {
      return clients.computeIfAbsent(address, this::createClient);
    } catch (ReplicaUnavailableException e) {
      throw e;
    } catch (Exception e) {
      throw new ReplicaUnavailableException(
          address, String.format("Unable to create client for ingester %s", address), e);
    }
  }

  private ReplicaClient createClient(String address) {
    LOG.debug("Creating client for ingester={}", address);
    try {
      return clientFactory.create(address);
    } catch (IOException e) {
      throw new ReplicaUnavailableException(
          address, String.format("Unable to connect to ingester %s", address), e);
    }
  }

  /** Closes and forgets the client for the address, if one is cached. */
  public void evict(String address) {
    ReplicaClient client = clients.remove(address);
    if (client != null) {
      LOG.debug("Evicting client for ingester={}", address);
      closeQuietly(address, client);
    }
  }

  /** Evicts every cached client whose address is no longer part of the ring. */
  public int removeStaleClients(Set<String> liveAddresses) {
    AtomicInteger removed = new AtomicInteger();
    clients
        .keySet()
        .forEach(
            address -> {
              if (!liveAddresses.contains(address)) {
                evict(address);
                removed.getAndIncrement();
              }
            });
    LOG.debug(
        "Removed stale ingester clients. removed_clients={} current_client_count={}",
        removed.get(),
        clients.size());
    return removed.get();
  }

  public int size() {
    return clients.size();
  }

  @Override
  protected void startUp() {
    LOG.info("Starting ingester client pool");
  }

  @Override
  protected void shutDown() {
    LOG.info("Closing {} ingester clients", clients.size());
    clients.keySet().forEach(this::evict);
  }

  private static void closeQuietly(String address, ReplicaClient client) {
    try {
      client.close();
    } catch (IOException e) {
      LOG.warn("Failed to close client for ingester={}", address, e);
    }
  }
}
