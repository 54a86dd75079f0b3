package com.fluxreader;

import com.fluxreader.api.ApiResult;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.model.EntryStatus;
import com.fluxreader.core.Kernel;
import com.fluxreader.core.workflow.BatchSummary;
import com.fluxreader.core.workflow.DownloadOutcome;
import com.fluxreader.services.maintenance.PrefetchService;
import com.fluxreader.services.navigation.NavigationContext;
import com.fluxreader.services.navigation.NavigationDirection;
import com.fluxreader.services.navigation.NavigationResult;
import com.fluxreader.services.sync.StatusChangeResult;
import com.fluxreader.services.sync.SyncPrompt;
import com.fluxreader.services.sync.SyncReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Headless entry point. The data directory defaults to {@code ./data} and can be set with
 * the {@code fluxreader.data} system property.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = String.join("\n",
            "Usage: fluxreader <command> [args]",
            "  sync                        push pending offline changes",
            "  download <id>...            download entries for offline reading",
            "  prefetch unread|starred     download the next entries of a listing",
            "  next|previous <id>          open the adjacent entry",
            "  status <id> read|unread     change the status of an entry",
            "  stats                       show local storage usage",
            "  purge <days>                delete entries older than 7, 30, 90 or 180 days",
            "  recover-images              re-download missing images");

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println(USAGE);
            System.exit(2);
        }
        File dataDir = new File(System.getProperty("fluxreader.data", "data"));
        int exitCode;
        try (Kernel kernel = new Kernel(dataDir)) {
            kernel.start();
            exitCode = run(kernel, args[0], Arrays.copyOfRange(args, 1, args.length));
        } catch (IllegalArgumentException e) {
            logger.error(e.getMessage());
            System.out.println(USAGE);
            exitCode = 2;
        } catch (Exception e) {
            logger.error("CRITICAL FAILURE", e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }

    static int run(Kernel kernel, String command, String[] args) {
        kernel.getDownloadWorkflow().setViewer((id, html, context) -> logger.info("Entry {} ready: {}", id, html));

        switch (command.toLowerCase()) {
            case "sync": {
                SyncReport report = kernel.getSyncReconciler().sync(SyncPrompt.AUTO_CONFIRM);
                return report.failed() > 0 ? 1 : 0;
            }
            case "download":
                return download(kernel, parseIds(args));
            case "prefetch": {
                PrefetchService.Source source = PrefetchService.Source.valueOf(requireArg(args, 0, "listing").toUpperCase());
                int count = Math.max(kernel.getConfigManager().getConfig().prefetchCount, 1);
                BatchSummary summary = kernel.getPrefetchService().prefetch(source, count);
                logger.info(summary.message());
                return summary.failed() > 0 ? 1 : 0;
            }
            case "next":
            case "previous": {
                NavigationDirection direction = command.equalsIgnoreCase("next")
                        ? NavigationDirection.NEXT : NavigationDirection.PREVIOUS;
                long id = parseId(requireArg(args, 0, "entry id"));
                NavigationResult result = kernel.getNavigator().navigate(id, direction, NavigationContext.global());
                if (result.status() == NavigationResult.Status.OPENED) {
                    kernel.getStatusService().autoMarkAsRead(result.targetEntryId());
                    return 0;
                }
                return result.status() == NavigationResult.Status.NO_MORE_ENTRIES ? 0 : 1;
            }
            case "status": {
                long id = parseId(requireArg(args, 0, "entry id"));
                EntryStatus status = EntryStatus.fromWire(requireArg(args, 1, "status"));
                if (status == null || status == EntryStatus.REMOVED) {
                    throw new IllegalArgumentException("Status must be read or unread");
                }
                StatusChangeResult result = kernel.getStatusService().changeEntryStatus(id, status);
                logger.info(result.message());
                return result.isAccepted() ? 0 : 1;
            }
            case "stats":
                logger.info(kernel.getStorageMaintenance().describe());
                logger.info("Pending changes: {}", kernel.getQueueManager().getTotalQueueCount());
                return 0;
            case "purge": {
                int days = Integer.parseInt(requireArg(args, 0, "days"));
                kernel.getStorageMaintenance().deleteOlderThan(days);
                return 0;
            }
            case "recover-images":
                kernel.getStorageMaintenance().recoverImages(kernel.getImageDownloader());
                return 0;
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private static int download(Kernel kernel, List<Long> ids) {
        if (ids.isEmpty()) throw new IllegalArgumentException("No entry ids given");
        List<Entry> entries = new ArrayList<>();
        for (long id : ids) {
            fetch(kernel, id).ifPresent(entries::add);
        }
        int unavailable = ids.size() - entries.size();
        if (entries.isEmpty()) return 1;
        if (entries.size() == 1) {
            DownloadOutcome outcome = kernel.getDownloadWorkflow().downloadAndOpen(entries.get(0), NavigationContext.global());
            logger.info("{}: {}", outcome.status(), outcome.message());
            return outcome.isAvailable() && unavailable == 0 ? 0 : 1;
        }
        BatchSummary summary = kernel.getBatchWorkflow().downloadAll(entries);
        return summary.failed() > 0 || summary.cancelled() || unavailable > 0 ? 1 : 0;
    }

    private static Optional<Entry> fetch(Kernel kernel, long id) {
        if (kernel.getEntryStore().isDownloaded(id)) {
            return Optional.of(new Entry(id, null));
        }
        ApiResult<Entry> result = kernel.getGateway().getEntry(id);
        if (!result.isOk()) {
            logger.error("Could not fetch entry {}: {}", id, result.getError());
            return Optional.empty();
        }
        return Optional.of(result.getValue());
    }

    private static List<Long> parseIds(String[] args) {
        List<Long> ids = new ArrayList<>();
        for (String arg : args) {
            ids.add(parseId(arg));
        }
        return ids;
    }

    private static long parseId(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an entry id: " + value);
        }
    }

    private static String requireArg(String[] args, int index, String name) {
        if (args.length <= index) throw new IllegalArgumentException("Missing argument: " + name);
        return args[index];
    }
}
