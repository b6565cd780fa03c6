package com.example.audiobook.adapters;

/**
 * Observes the availability of a qualifying (restricted-mode) network.
 */
public interface ConnectivityMonitor {
    boolean isQualifyingNetworkAvailable();

    void addListener(ConnectivityListener listener);

    void removeListener(ConnectivityListener listener);

    /**
     * Start observing connectivity transitions.
     */
    void start();

    /**
     * Stop observing and release every registered listener.
     */
    void stop();
}
