package com.example.audiobook.adapters.network;

import com.example.audiobook.adapters.ConnectivityListener;
import com.example.audiobook.adapters.ConnectivityMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.net.NetworkInterface;
import java.net.SocketException;
import java.time.Duration;
import java.util.Collections;
import java.util.Enumeration;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.regex.Pattern;

/**
 * Polls the network interfaces of the host. A network qualifies when an interface is up, not a
 * loopback or virtual interface, and its name matches the configured pattern.
 */
@Slf4j
public class NetworkInterfaceConnectivityMonitor implements ConnectivityMonitor {
    private final TaskScheduler scheduler;
    private final Pattern interfacePattern;
    private final Duration checkInterval;
    private final Queue<ConnectivityListener> listeners = new ConcurrentLinkedQueue<>();

    private volatile boolean available;
    private ScheduledFuture<?> pollTask;

    public NetworkInterfaceConnectivityMonitor(TaskScheduler scheduler, String interfacePattern, Duration checkInterval) {
        this.scheduler = scheduler;
        this.interfacePattern = Pattern.compile(interfacePattern);
        this.checkInterval = checkInterval;
    }

    @Override
    public boolean isQualifyingNetworkAvailable() {
        return available;
    }

    @Override
    public void addListener(ConnectivityListener listener) {
        Objects.requireNonNull(listener, "listener cannot be null");
        listeners.add(listener);
    }

    @Override
    public void removeListener(ConnectivityListener listener) {
        listeners.remove(listener);
    }

    @Override
    public synchronized void start() {
        if (pollTask != null) {
            return;
        }
        available = detectQualifyingNetwork();
        log.info("Connectivity monitor started, qualifying network available: {}", available);
        pollTask = scheduler.scheduleWithFixedDelay(this::poll, checkInterval);
    }

    @Override
    public synchronized void stop() {
        if (pollTask != null) {
            pollTask.cancel(true);
            pollTask = null;
        }
        listeners.clear();
        log.info("Connectivity monitor stopped");
    }

    void poll() {
        boolean current = detectQualifyingNetwork();
        if (current == available) {
            return;
        }

        available = current;
        log.info("Qualifying network {}", current ? "available" : "lost");
        for (ConnectivityListener listener : listeners) {
            try {
                if (current) {
                    listener.onAvailable();
                } else {
                    listener.onLost();
                }
            } catch (RuntimeException e) {
                log.error("Connectivity listener failed: {}", e.getMessage(), e);
            }
        }
    }

    boolean detectQualifyingNetwork() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            if (interfaces == null) {
                return false;
            }
            for (NetworkInterface networkInterface : Collections.list(interfaces)) {
                if (networkInterface.isUp()
                        && !networkInterface.isLoopback()
                        && !networkInterface.isVirtual()
                        && interfacePattern.matcher(networkInterface.getName()).matches()) {
                    return true;
                }
            }
        } catch (SocketException e) {
            log.warn("Unable to enumerate network interfaces: {}", e.getMessage());
        }
        return false;
    }
}
