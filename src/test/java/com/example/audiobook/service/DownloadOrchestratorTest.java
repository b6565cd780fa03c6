package com.example.audiobook.service;

import com.example.audiobook.adapters.ConnectivityMonitor;
import com.example.audiobook.adapters.DownloadEngine;
import com.example.audiobook.adapters.LicenseProvider;
import com.example.audiobook.adapters.preferences.PropertiesPreferenceStore;
import com.example.audiobook.config.ApplicationConfig;
import com.example.audiobook.exception.DownloadEngineException;
import com.example.audiobook.exception.LicenseException;
import com.example.audiobook.utils.model.DownloadState;
import com.example.audiobook.utils.model.DownloadTaskRequest;
import com.example.audiobook.utils.model.EnqueueRequest;
import com.example.audiobook.utils.model.ErrorEvent;
import com.example.audiobook.utils.model.ItemStatus;
import com.example.audiobook.utils.model.License;
import com.example.audiobook.utils.model.WorkItem;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DownloadOrchestratorTest {
    private static Validator validator;

    @Mock
    private DownloadEngine downloadEngine;
    @Mock
    private LicenseProvider licenseProvider;
    @Mock
    private ConversionService conversionService;
    @Mock
    private NetworkPolicyService networkPolicy;
    @Mock
    private ManualPauseLedger manualPauseLedger;
    @Mock
    private PipelineEventPublisher eventPublisher;
    @TempDir
    Path stagingDir;

    private ApplicationConfig config;
    private final List<Runnable> submitted = new ArrayList<>();
    private ExecutorService executorService;

    @BeforeAll
    static void setUpValidator() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @BeforeEach
    void setUp() {
        config = new ApplicationConfig();
        config.setStagingDirectory(stagingDir.toString());
        config.setPollInterval(Duration.ofMillis(1));
    }

    @AfterEach
    void tearDown() {
        if (executorService != null) {
            executorService.shutdownNow();
        }
    }

    @Test
    void testStartMonitoring_whenStartedTwice_shouldKeepExactlyOneMonitor() {
        var orchestrator = createOrchestrator(submitted::add);
        var item = TranscodeRequestFactoryTest.workItem();

        orchestrator.startMonitoring(item);
        orchestrator.startMonitoring(item);

        assertEquals(Set.of("B0001"), orchestrator.getActiveItemIds());
        assertEquals(2, submitted.size());
        assertTrue(((FutureTask<?>) submitted.get(0)).isCancelled());
        assertFalse(((FutureTask<?>) submitted.get(1)).isCancelled());
    }

    @Test
    void testCancel_whenCalledTwice_shouldBeNoopTheSecondTime() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem());

        assertTrue(orchestrator.cancel("B0001"));
        assertFalse(orchestrator.cancel("B0001"));

        verify(downloadEngine, times(1)).cancel("task-1");
        verify(manualPauseLedger, times(1)).clear("B0001");
        assertFalse(orchestrator.isMonitoring("B0001"));
        assertTrue(((FutureTask<?>) submitted.get(0)).isCancelled());
        verify(eventPublisher, never()).publishError(any());
    }

    @Test
    void testCancel_whenEngineRejectsCancel_shouldNotThrow() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem());
        doThrow(new DownloadEngineException("gone")).when(downloadEngine).cancel("task-1");

        assertTrue(orchestrator.cancel("B0001"));
    }

    @Test
    void testStartMonitoring_whenMonitorExits_shouldRemoveItselfFromActiveSet() throws Exception {
        var orchestrator = createOrchestrator(Runnable::run);
        when(downloadEngine.getStatus("task-1")).thenReturn(ItemStatus.builder()
                .taskId("task-1")
                .itemId("B0001")
                .state(DownloadState.CANCELLED)
                .build());

        orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem());

        assertFalse(orchestrator.isMonitoring("B0001"));
        assertFalse(orchestrator.cancel("B0001"));
    }

    @Test
    void testEnqueue_whenDownloadCompletes_shouldRunConversion() throws Exception {
        executorService = Executors.newCachedThreadPool();
        var orchestrator = createOrchestrator(executorService);
        when(licenseProvider.obtainLicense("B0001", "High")).thenReturn(License.builder()
                .downloadUrl("https://cdn.example.com/B0001.aax")
                .totalBytes(1000)
                .key("key")
                .iv("iv")
                .requestHeader("User-Agent", "pipeline")
                .build());
        when(downloadEngine.enqueue(any())).thenReturn("task-1");
        when(downloadEngine.getStatus("task-1")).thenReturn(ItemStatus.builder()
                .taskId("task-1")
                .itemId("B0001")
                .state(DownloadState.COMPLETED)
                .bytesDownloaded(1000)
                .totalBytes(1000)
                .build());
        var requestCaptor = ArgumentCaptor.forClass(DownloadTaskRequest.class);
        var itemCaptor = ArgumentCaptor.forClass(WorkItem.class);

        var result = orchestrator.enqueue(new EnqueueRequest("B0001", "T", "/library", null));

        assertEquals(Optional.of("task-1"), result);
        verify(conversionService, timeout(5000)).convert(itemCaptor.capture());
        verify(downloadEngine).enqueue(requestCaptor.capture());
        var request = requestCaptor.getValue();
        assertEquals(stagingDir.resolve("B0001.aax"), request.getDownloadPath());
        assertEquals(stagingDir.resolve("B0001.m4b"), request.getOutputPath());
        assertEquals("pipeline", request.getRequestHeaders().get("User-Agent"));
        var item = itemCaptor.getValue();
        assertEquals("task-1", item.getTaskId());
        assertEquals("/library", item.getDestinationDirectory());
        assertEquals("key", item.getKey());
    }

    @Test
    void testEnqueue_whenRequestIsInvalid_shouldPublishErrorAndReturnEmpty() {
        var orchestrator = createOrchestrator(submitted::add);

        var result = orchestrator.enqueue(new EnqueueRequest("B0001", "T", " ", null));

        assertEquals(Optional.empty(), result);
        verify(eventPublisher).publishError(new ErrorEvent("B0001", "T", "Invalid request: destination directory is required"));
        verifyNoInteractions(licenseProvider, downloadEngine);
    }

    @Test
    void testEnqueue_whenLicenseIsRefused_shouldPublishErrorAndReturnEmpty() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        when(licenseProvider.obtainLicense("B0001", "Normal")).thenThrow(new LicenseException("Not owned"));

        var result = orchestrator.enqueue(new EnqueueRequest("B0001", "T", "/library", "Normal"));

        assertEquals(Optional.empty(), result);
        verify(eventPublisher).publishError(new ErrorEvent("B0001", "T", "Not owned"));
        verifyNoInteractions(downloadEngine);
        assertTrue(submitted.isEmpty());
    }

    @Test
    void testManuallyPause_whenEnginePauses_shouldMarkLedger() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem());

        assertTrue(orchestrator.manuallyPause("B0001"));

        verify(downloadEngine).pause("task-1");
        verify(manualPauseLedger).mark("B0001");
    }

    @Test
    void testManuallyPause_whenTaskIsUnknownLocally_shouldLookItUpInEngine() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        when(downloadEngine.listByStatus(DownloadState.QUEUED)).thenReturn(List.of());
        when(downloadEngine.listByStatus(DownloadState.DOWNLOADING)).thenReturn(List.of(ItemStatus.builder()
                .taskId("task-9")
                .itemId("B0009")
                .state(DownloadState.DOWNLOADING)
                .build()));

        assertTrue(orchestrator.manuallyPause("B0009"));

        verify(downloadEngine).pause("task-9");
        verify(manualPauseLedger).mark("B0009");
    }

    @Test
    void testManuallyPause_whenEngineRejects_shouldRemoveLedgerMarker() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        when(manualPauseLedger.mark("B0001")).thenReturn(true);
        doThrow(new DownloadEngineException("invalid state")).when(downloadEngine).pause("task-1");

        assertFalse(orchestrator.manuallyPause("B0001", "task-1"));

        verify(manualPauseLedger).clear("B0001");
    }

    @Test
    void testManuallyPause_whenPreferencesCannotBeSaved_shouldReturnFalseAndLeaveDownloadRunning() throws Exception {
        var ledger = new ManualPauseLedger(unwritablePreferences());
        var orchestrator = createOrchestrator(ledger, new ItemLockRegistry(), submitted::add);

        assertFalse(orchestrator.manuallyPause("B0001", "task-1"));

        verify(downloadEngine, never()).pause(any());
        assertFalse(ledger.contains("B0001"));
    }

    @Test
    void testManuallyResume_whenPauseMarkerCannotBeCleared_shouldReturnFalseAndKeepPaused() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        when(manualPauseLedger.clear("B0001")).thenThrow(new UncheckedIOException("Failed to save preferences", new IOException("read-only")));

        assertFalse(orchestrator.manuallyResume("B0001", "task-1"));

        verify(downloadEngine, never()).resume(any());
    }

    @Test
    void testManuallyResume_whenEngineRejects_shouldRestoreLedgerMarker() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        when(manualPauseLedger.clear("B0001")).thenReturn(true);
        doThrow(new DownloadEngineException("invalid state")).when(downloadEngine).resume("task-1");

        assertFalse(orchestrator.manuallyResume("B0001", "task-1"));

        verify(manualPauseLedger).mark("B0001");
    }

    @Test
    void testCancel_whenPauseMarkerCannotBeCleared_shouldStillCancel() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);
        orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem());
        when(manualPauseLedger.clear("B0001")).thenThrow(new UncheckedIOException("Failed to save preferences", new IOException("read-only")));

        assertTrue(orchestrator.cancel("B0001"));

        verify(downloadEngine).cancel("task-1");
        assertFalse(orchestrator.isMonitoring("B0001"));
        assertTrue(((FutureTask<?>) submitted.get(0)).isCancelled());
    }

    @Test
    void testStopMonitoring_whenPauseMarkerCannotBeCleared_shouldStillStop() {
        var orchestrator = createOrchestrator(submitted::add);
        orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem());
        when(manualPauseLedger.clear("B0001")).thenThrow(new UncheckedIOException("Failed to save preferences", new IOException("read-only")));

        assertTrue(orchestrator.stopMonitoring("B0001"));

        assertFalse(orchestrator.isMonitoring("B0001"));
    }

    @Test
    void testCancel_whenConversionIsRunning_shouldInterruptItWithoutPublishingAnOutcome() throws Exception {
        executorService = Executors.newCachedThreadPool();
        var orchestrator = createOrchestrator(executorService);
        var conversionStarted = new CountDownLatch(1);
        var conversionInterrupted = new CountDownLatch(1);
        when(downloadEngine.getStatus("task-1")).thenReturn(ItemStatus.builder()
                .taskId("task-1")
                .itemId("B0001")
                .state(DownloadState.COMPLETED)
                .build());
        when(conversionService.convert(any())).thenAnswer(invocation -> {
            conversionStarted.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                conversionInterrupted.countDown();
                throw e;
            }
            return "/library/T.m4b";
        });

        orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem());
        assertTrue(conversionStarted.await(5, TimeUnit.SECONDS));

        assertTrue(orchestrator.cancel("B0001"));

        assertTrue(conversionInterrupted.await(5, TimeUnit.SECONDS));
        verify(eventPublisher, after(200).never()).publishError(any());
        verify(eventPublisher, never()).publishCompletion(any());
        assertFalse(orchestrator.isMonitoring("B0001"));
    }

    @Test
    void testManuallyPause_whenResumeSweepRunsConcurrently_shouldStayPaused() throws Exception {
        executorService = Executors.newSingleThreadExecutor();
        var itemLocks = new ItemLockRegistry();
        var ledger = new ManualPauseLedger(new PropertiesPreferenceStore(stagingDir.resolve("prefs.cfg")));
        var policy = new NetworkPolicyService(new PropertiesPreferenceStore(stagingDir.resolve("policy.cfg")),
                mock(ConnectivityMonitor.class), downloadEngine, ledger, itemLocks, Runnable::run);
        var orchestrator = createOrchestrator(ledger, itemLocks, submitted::add);
        var pauseIssued = new CountDownLatch(1);
        when(downloadEngine.listByStatus(DownloadState.PAUSED)).thenReturn(List.of(ItemStatus.builder()
                .taskId("task-1")
                .itemId("B0001")
                .state(DownloadState.PAUSED)
                .build()));
        doAnswer(invocation -> {
            pauseIssued.countDown();
            Thread.sleep(200);
            return null;
        }).when(downloadEngine).pause("task-1");

        var sweep = executorService.submit(() -> {
            pauseIssued.await();
            return policy.resumePausedDownloads();
        });
        assertTrue(orchestrator.manuallyPause("B0001", "task-1"));

        assertEquals(0, sweep.get(5, TimeUnit.SECONDS));
        verify(downloadEngine, never()).resume(any());
        assertTrue(ledger.contains("B0001"));
    }

    @Test
    void testManuallyResume_whenEngineResumes_shouldClearLedger() throws Exception {
        var orchestrator = createOrchestrator(submitted::add);

        assertTrue(orchestrator.manuallyResume("B0001", "task-1"));

        verify(downloadEngine).resume("task-1");
        verify(manualPauseLedger).clear("B0001");
    }

    @Test
    void testShutdown_shouldCancelMonitorsAndReleaseNetworkPolicy() {
        var orchestrator = createOrchestrator(submitted::add);
        orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem());

        orchestrator.shutdown();

        assertTrue(orchestrator.getActiveItemIds().isEmpty());
        assertTrue(((FutureTask<?>) submitted.get(0)).isCancelled());
        verify(networkPolicy).shutdown();
        verify(eventPublisher).removeAllListeners();
    }

    @Test
    void testSetRestrictedOnlyMode_shouldDelegateToNetworkPolicy() {
        var orchestrator = createOrchestrator(submitted::add);

        assertTrue(orchestrator.setRestrictedOnlyMode(true));

        verify(networkPolicy).setRestrictedOnlyMode(eq(true));
    }

    @Test
    void testSetRestrictedOnlyMode_whenPreferenceCannotBeSaved_shouldReturnFalse() {
        var orchestrator = createOrchestrator(submitted::add);
        doThrow(new UncheckedIOException("Failed to save preferences", new IOException("read-only")))
                .when(networkPolicy).setRestrictedOnlyMode(true);

        assertFalse(orchestrator.setRestrictedOnlyMode(true));
    }

    @Test
    void testEnqueue_whenRequestIsNull_shouldReturnEmpty() {
        var orchestrator = createOrchestrator(submitted::add);

        assertEquals(Optional.empty(), orchestrator.enqueue(null));

        verifyNoInteractions(licenseProvider, downloadEngine);
    }

    @Test
    void testStartMonitoring_whenExecutorRejects_shouldPublishErrorAndNotMonitor() {
        var orchestrator = createOrchestrator(e -> {
            throw new RejectedExecutionException("pool exhausted");
        });

        assertFalse(orchestrator.startMonitoring(TranscodeRequestFactoryTest.workItem()));

        verify(eventPublisher).publishError(new ErrorEvent("B0001", "T", "Failed to start monitoring: pool exhausted"));
        assertFalse(orchestrator.isMonitoring("B0001"));
    }

    private DownloadOrchestrator createOrchestrator(Executor executor) {
        return createOrchestrator(manualPauseLedger, new ItemLockRegistry(), executor);
    }

    private DownloadOrchestrator createOrchestrator(ManualPauseLedger ledger, ItemLockRegistry itemLocks, Executor executor) {
        return new DownloadOrchestrator(downloadEngine, licenseProvider, conversionService, networkPolicy,
                ledger, itemLocks, eventPublisher, validator, config, executor);
    }

    private PropertiesPreferenceStore unwritablePreferences() throws IOException {
        var blocker = Files.writeString(stagingDir.resolve("blocked"), "not a directory");
        return new PropertiesPreferenceStore(blocker.resolve("prefs.cfg"));
    }
}
