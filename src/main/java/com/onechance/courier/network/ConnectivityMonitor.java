package com.onechance.courier.network;

import com.onechance.courier.config.server.NetworkConfig;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Connectivity monitor.
 * <p>Probes several independent endpoints in parallel with HEAD requests.
 * <br>The host is online when at least one endpoint answers with any HTTP response.
 * <p>A background probe runs on a fixed interval once {@link #start()} is called.
 * <br>Probes are single-flight, a scheduled probe is skipped while another one is running.
 * <p>Probe failures are never raised, they only turn the flag offline.
 */
public class ConnectivityMonitor implements Connectivity, Closeable {
    private static final Logger log = LogManager.getLogger(ConnectivityMonitor.class);

    private final List<String> endpoints;
    private final Duration checkInterval;
    private final Duration initialDelay;
    private final Duration probeTimeout;
    private final OkHttpClient probeClient;
    private final OkHttpClient latencyClient;
    private final Clock clock;

    private final AtomicReference<NetworkStatus> status;
    private final ReentrantLock probeLock = new ReentrantLock();
    private final List<ConnectivityListener> listeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;

    /**
     * Constructs a new ConnectivityMonitor instance.
     *
     * @param config NetworkConfig instance.
     */
    public ConnectivityMonitor(NetworkConfig config) {
        this(config, new OkHttpClient(), Clock.systemUTC());
    }

    /**
     * Constructs a new ConnectivityMonitor instance with given HTTP client and clock.
     *
     * @param config     NetworkConfig instance.
     * @param httpClient Base HTTP client, timeouts are applied on top.
     * @param clock      Clock for status timestamps.
     */
    public ConnectivityMonitor(NetworkConfig config, OkHttpClient httpClient, Clock clock) {
        this.endpoints = List.copyOf(config.getEndpoints());
        this.checkInterval = config.getCheckInterval();
        this.initialDelay = config.getInitialDelay();
        this.probeTimeout = config.getProbeTimeout();
        this.clock = clock;

        this.probeClient = httpClient.newBuilder()
                .callTimeout(probeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();
        this.latencyClient = httpClient.newBuilder()
                .callTimeout(config.getLatencyTestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .retryOnConnectionFailure(false)
                .build();

        this.status = new AtomicReference<>(NetworkStatus.initial(config.isInitiallyOnline(), clock.instant()));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemon("courier-network"));
        this.probeExecutor = Executors.newCachedThreadPool(daemon("courier-probe"));
    }

    /**
     * Starts background probing.
     */
    public void start() {
        scheduler.scheduleAtFixedRate(() -> {
            try {
                scheduledCheck();
            } catch (Exception e) {
                log.error("Connectivity check error: {}", e.getMessage());
            }
        }, initialDelay.toMillis(), checkInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Connectivity monitor started: endpoints={}, intervalSeconds={}", endpoints, checkInterval.toSeconds());
    }

    @Override
    public boolean isOnline() {
        return status.get().online();
    }

    /**
     * Gets the current status snapshot.
     *
     * @return NetworkStatus instance.
     */
    public NetworkStatus getStatus() {
        return status.get();
    }

    /**
     * Performs a fresh probe and waits for its result.
     * <p>Waits for a probe already in progress to finish first.
     *
     * @return Online flag after the probe.
     */
    public boolean forceCheck() {
        probeLock.lock();
        try {
            return probe();
        } finally {
            probeLock.unlock();
        }
    }

    /**
     * Scheduled probe, skipped when a probe is already running.
     */
    void scheduledCheck() {
        if (!probeLock.tryLock()) {
            log.trace("Probe already in progress, skipping");
            return;
        }
        try {
            probe();
        } finally {
            probeLock.unlock();
        }
    }

    /**
     * Platform connectivity notification.
     * <p>Applies the reported flag immediately and schedules a fresh probe to confirm it.
     *
     * @param online Reported online flag.
     */
    public void notifyConnectivityChange(boolean online) {
        log.info("Platform reported connectivity {}", online ? "online" : "offline");
        update(online, null);
        if (online && !scheduler.isShutdown()) {
            scheduler.execute(this::scheduledCheck);
        }
    }

    /**
     * Probes all endpoints and updates status.
     *
     * @return Online flag.
     */
    private boolean probe() {
        CompletableFuture<Long> firstSuccess = new CompletableFuture<>();
        List<CompletableFuture<Long>> futures = new ArrayList<>();
        for (String endpoint : endpoints) {
            CompletableFuture<Long> future = CompletableFuture.supplyAsync(() -> probeEndpoint(endpoint), probeExecutor);
            future.thenAccept(rtt -> {
                if (rtt != null) {
                    firstSuccess.complete(rtt);
                }
            });
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .whenComplete((ignored, error) -> firstSuccess.complete(null));

        Long rtt;
        try {
            rtt = firstSuccess.get(probeTimeout.toMillis() + 1000L, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.debug("Probe did not complete: {}", e.getMessage());
            rtt = null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return isOnline();
        }

        boolean online = rtt != null;
        log.debug("Probe complete: online={}, rttMillis={}", online, rtt);
        update(online, rtt);
        return online;
    }

    /**
     * Issues one HEAD request.
     *
     * @param endpoint URL.
     * @return Round trip in milliseconds, null on failure.
     */
    private Long probeEndpoint(String endpoint) {
        long start = System.nanoTime();
        Request request = new Request.Builder()
                .url(endpoint)
                .head()
                .header("Cache-Control", "no-cache")
                .build();
        try (Response response = probeClient.newCall(request).execute()) {
            long rtt = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            log.trace("Probe {} answered {} in {}ms", endpoint, response.code(), rtt);
            return rtt;
        } catch (IOException | IllegalArgumentException e) {
            log.trace("Probe {} failed: {}", endpoint, e.getMessage());
            return null;
        }
    }

    /**
     * Runs a single timed HEAD request against the first endpoint.
     * <p>A successful measurement is kept as the current round trip time.
     * <br>Failures, including a missing or malformed endpoint, are reported in the result.
     *
     * @return ConnectivityTestResult instance.
     */
    public ConnectivityTestResult testConnectivity() {
        if (endpoints.isEmpty()) {
            return new ConnectivityTestResult(false, null, "No endpoints configured");
        }

        long start = System.nanoTime();
        try (Response ignored = latencyClient.newCall(new Request.Builder()
                .url(endpoints.get(0))
                .head()
                .header("Cache-Control", "no-cache")
                .build()).execute()) {
            long latency = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            status.updateAndGet(current -> new NetworkStatus(current.online(), current.lastChecked(),
                    current.lastOnline(), current.lastOffline(), latency));
            return new ConnectivityTestResult(true, latency, null);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("Latency test against {} failed: {}", endpoints.get(0), e.getMessage());
            return new ConnectivityTestResult(false, null, e.getMessage());
        }
    }

    /**
     * Gets connection quality.
     *
     * @return ConnectionQuality.
     */
    public ConnectionQuality getConnectionQuality() {
        return ConnectionQuality.of(status.get());
    }

    /**
     * Gets a human readable status line.
     * <p>Examples: {@code Online (Good connection)}, {@code Offline for 1m 5s}.
     *
     * @return Status text.
     */
    public String getStatusText() {
        NetworkStatus current = status.get();
        if (!current.online()) {
            long seconds = current.lastOffline() != null
                    ? Math.max(0L, Duration.between(current.lastOffline(), clock.instant()).getSeconds())
                    : 0L;
            if (seconds > 60) {
                return "Offline for " + (seconds / 60) + "m " + (seconds % 60) + "s";
            }
            return "Offline for " + seconds + "s";
        }
        return "Online (" + ConnectionQuality.of(current).getLabel() + " connection)";
    }

    /**
     * Applies a check result and notifies listeners on transition.
     */
    private void update(boolean online, Long rtt) {
        NetworkStatus previous = status.getAndUpdate(current -> current.next(online, clock.instant(), rtt));
        if (previous.online() != online) {
            log.info("Network status changed: {} -> {}", previous.online() ? "online" : "offline", online ? "online" : "offline");
            for (ConnectivityListener listener : listeners) {
                try {
                    listener.onConnectivityChanged(online);
                } catch (RuntimeException e) {
                    log.error("Connectivity listener error: {}", e.getMessage());
                }
            }
        }
    }

    @Override
    public void addListener(ConnectivityListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ConnectivityListener listener) {
        listeners.remove(listener);
    }

    /**
     * Stops background probing.
     */
    @Override
    public void close() {
        scheduler.shutdownNow();
        probeExecutor.shutdownNow();
        log.debug("Connectivity monitor stopped");
    }

    private static ThreadFactory daemon(String name) {
        return runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }
}
