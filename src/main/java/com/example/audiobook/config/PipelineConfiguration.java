package com.example.audiobook.config;

import com.example.audiobook.adapters.ConnectivityMonitor;
import com.example.audiobook.adapters.CoverArtFetcher;
import com.example.audiobook.adapters.DestinationStorage;
import com.example.audiobook.adapters.MediaProbe;
import com.example.audiobook.adapters.MetadataStore;
import com.example.audiobook.adapters.PreferenceStore;
import com.example.audiobook.adapters.TranscodingEngine;
import com.example.audiobook.adapters.ffmpeg.FfmpegMediaProbe;
import com.example.audiobook.adapters.ffmpeg.FfmpegTranscodingEngine;
import com.example.audiobook.adapters.http.HttpCoverArtFetcher;
import com.example.audiobook.adapters.metadata.JsonMetadataStore;
import com.example.audiobook.adapters.network.NetworkInterfaceConnectivityMonitor;
import com.example.audiobook.adapters.preferences.PropertiesPreferenceStore;
import com.example.audiobook.adapters.storage.FileSystemDestinationStorage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Paths;

@Configuration
@EnableConfigurationProperties(ApplicationConfig.class)
public class PipelineConfiguration {
    @Bean
    public ThreadPoolTaskExecutor pipelineExecutor(ApplicationConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getMonitorPoolSize());
        // every monitor holds its thread for the whole item lifecycle, so never queue them
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(config.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler connectivityScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("Connectivity-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    @ConditionalOnMissingBean
    public PreferenceStore preferenceStore(ApplicationConfig config) {
        return new PropertiesPreferenceStore(Paths.get(config.getPreferencesFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MetadataStore metadataStore(ApplicationConfig config) {
        return new JsonMetadataStore(Paths.get(config.getLibraryFile()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TranscodingEngine transcodingEngine(ApplicationConfig config) {
        return new FfmpegTranscodingEngine(config.getFfmpegPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public MediaProbe mediaProbe(ApplicationConfig config) {
        return new FfmpegMediaProbe(config.getFfmpegPath(), config.getFfprobePath());
    }

    @Bean
    @ConditionalOnMissingBean
    public DestinationStorage destinationStorage() {
        return new FileSystemDestinationStorage();
    }

    @Bean
    @ConditionalOnMissingBean
    public CoverArtFetcher coverArtFetcher(ApplicationConfig config) {
        return new HttpCoverArtFetcher(config.getStagingPath(), config.getCoverArtTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectivityMonitor connectivityMonitor(ApplicationConfig config, ThreadPoolTaskScheduler connectivityScheduler) {
        return new NetworkInterfaceConnectivityMonitor(connectivityScheduler,
                config.getQualifyingInterfacePattern(), config.getConnectivityCheckInterval());
    }
}
