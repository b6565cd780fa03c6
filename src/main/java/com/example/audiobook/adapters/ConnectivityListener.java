package com.example.audiobook.adapters;

public interface ConnectivityListener {
    /**
     * Invoked when a qualifying network became available.
     */
    void onAvailable();

    /**
     * Invoked when the last qualifying network was lost.
     */
    void onLost();
}
