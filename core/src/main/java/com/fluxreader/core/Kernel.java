package com.fluxreader.core;

import com.fluxreader.api.EntryGateway;
import com.fluxreader.api.GatewayFactory;
import com.fluxreader.api.MinifluxGateway;
import com.fluxreader.api.Notifier;
import com.fluxreader.core.config.ConfigManager;
import com.fluxreader.core.config.ConfigValidator;
import com.fluxreader.core.config.Configuration;
import com.fluxreader.core.pipeline.DefaultContentPipeline;
import com.fluxreader.core.pipeline.ImageDownloader;
import com.fluxreader.core.queue.QueueManager;
import com.fluxreader.core.workflow.BatchDownloadWorkflow;
import com.fluxreader.core.workflow.DownloadWorkflow;
import com.fluxreader.services.maintenance.AutoDeletePolicy;
import com.fluxreader.services.maintenance.PrefetchService;
import com.fluxreader.services.maintenance.StorageMaintenance;
import com.fluxreader.services.navigation.EntryNavigator;
import com.fluxreader.services.navigation.NavigationCursor;
import com.fluxreader.services.store.EntryInfoCache;
import com.fluxreader.services.store.EntryPaths;
import com.fluxreader.services.store.LocalEntryStore;
import com.fluxreader.services.sync.BackgroundStatusWorker;
import com.fluxreader.services.sync.EntryStatusService;
import com.fluxreader.services.sync.SyncReconciler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the reader's components over one data directory.
 * <p>
 * Layout: {@code config.json}, {@code queue/} for pending changes and the download directory
 * (default {@code miniflux/}) with one sub-directory per entry.
 */
public class Kernel implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);

    private final File dataDir;
    private final ConfigManager configManager;
    private final QueueManager queueManager;
    private final EntryInfoCache entryCache;
    private final LocalEntryStore entryStore;
    private final EntryGateway gateway;
    private final ImageDownloader imageDownloader;
    private final DownloadWorkflow downloadWorkflow;
    private final BatchDownloadWorkflow batchWorkflow;
    private final EntryNavigator navigator;
    private final SyncReconciler syncReconciler;
    private final BackgroundStatusWorker statusWorker;
    private final EntryStatusService statusService;
    private final StorageMaintenance storageMaintenance;
    private final AutoDeletePolicy autoDeletePolicy;
    private final PrefetchService prefetchService;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public Kernel(File dataDir) {
        this(dataDir, new LoggingNotifier(), null);
    }

    /**
     * @param gatewayFactory builds the server client; {@code null} uses the Miniflux HTTP client
     */
    public Kernel(File dataDir, Notifier notifier, GatewayFactory gatewayFactory) {
        this.dataDir = dataDir;
        if (!dataDir.exists() && !dataDir.mkdirs()) {
            logger.warn("Could not create data directory {}", dataDir.getAbsolutePath());
        }

        this.configManager = new ConfigManager(dataDir);
        Configuration config = configManager.getConfig();

        GatewayFactory factory = gatewayFactory != null
                ? gatewayFactory
                : (server, token) -> new MinifluxGateway(server, token, config.apiTimeoutMs);
        File queueDir = new File(dataDir, "queue");

        this.queueManager = new QueueManager(queueDir);
        this.entryCache = new EntryInfoCache();
        this.entryStore = new LocalEntryStore(new EntryPaths(config.resolveDownloadDir(dataDir)), entryCache);
        this.gateway = factory.create(config.serverAddress, config.apiToken);

        this.imageDownloader = new ImageDownloader(config);
        this.downloadWorkflow = new DownloadWorkflow(entryStore, new DefaultContentPipeline(imageDownloader), config, notifier);
        this.batchWorkflow = new BatchDownloadWorkflow(downloadWorkflow, gateway, entryStore, config);
        this.navigator = new EntryNavigator(gateway, entryStore, new NavigationCursor(entryStore.getPaths(), config),
                downloadWorkflow, notifier);

        this.syncReconciler = new SyncReconciler(queueManager, gateway, entryStore, notifier);
        this.statusWorker = new BackgroundStatusWorker(factory, queueDir);
        this.statusService = new EntryStatusService(gateway, queueManager, entryStore, notifier, config, statusWorker);

        this.storageMaintenance = new StorageMaintenance(entryStore);
        this.autoDeletePolicy = new AutoDeletePolicy(config, entryStore);
        this.prefetchService = new PrefetchService(gateway, entryStore, batchWorkflow, config, notifier);
    }

    public void start() {
        if (running.getAndSet(true))
            return;
        logger.info("Kernel booting in {}", dataDir.getAbsolutePath());

        int errors = new ConfigValidator(dataDir).validateAndReport(configManager.getConfig());
        if (errors > 0) {
            logger.warn("Configuration has {} error(s), server features will fail until fixed in {}",
                    errors, configManager.getConfigFile().getAbsolutePath());
        }
        entryCache.acquire();

        logger.info("Kernel active. {} pending change(s) queued.", queueManager.getTotalQueueCount().total());
    }

    public void shutdown() {
        if (!running.getAndSet(false))
            return;
        statusWorker.close();
        entryCache.release();
        logger.info("Kernel stopped.");
    }

    @Override
    public void close() {
        shutdown();
    }

    public boolean isRunning() {
        return running.get();
    }

    // --- Getters ---
    public File getDataDir() {
        return dataDir;
    }

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public QueueManager getQueueManager() {
        return queueManager;
    }

    public LocalEntryStore getEntryStore() {
        return entryStore;
    }

    public EntryGateway getGateway() {
        return gateway;
    }

    public ImageDownloader getImageDownloader() {
        return imageDownloader;
    }

    public DownloadWorkflow getDownloadWorkflow() {
        return downloadWorkflow;
    }

    public BatchDownloadWorkflow getBatchWorkflow() {
        return batchWorkflow;
    }

    public EntryNavigator getNavigator() {
        return navigator;
    }

    public SyncReconciler getSyncReconciler() {
        return syncReconciler;
    }

    public EntryStatusService getStatusService() {
        return statusService;
    }

    public StorageMaintenance getStorageMaintenance() {
        return storageMaintenance;
    }

    public AutoDeletePolicy getAutoDeletePolicy() {
        return autoDeletePolicy;
    }

    public PrefetchService getPrefetchService() {
        return prefetchService;
    }

    /**
     * Default notifier for headless use: notices go to the log.
     */
    static class LoggingNotifier implements Notifier {
        private static final Logger notices = LoggerFactory.getLogger("com.fluxreader.notices");

        @Override
        public void info(String message) {
            notices.info(message);
        }

        @Override
        public void error(String message) {
            notices.error(message);
        }
    }
}
