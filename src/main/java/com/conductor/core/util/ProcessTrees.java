package com.conductor.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Terminates a process together with every process it spawned.
 *
 * <p>Descendants are snapshotted before the root is signalled, because once the
 * root exits its children are re-parented and can no longer be found through it.
 */
public final class ProcessTrees {

    private static final Logger log = LoggerFactory.getLogger(ProcessTrees.class);

    private ProcessTrees() {}

    /**
     * Sends a polite termination signal to the whole tree, waits up to {@code grace}
     * for it to exit, then forcibly kills whatever is still alive.
     *
     * @return true if every process in the tree is gone on return
     */
    public static boolean terminate(ProcessHandle root, Duration grace) {
        Set<ProcessHandle> tree = snapshot(root);
        if (tree.isEmpty()) {
            return true;
        }
        log.debug("Terminating process tree of {} ({} processes)", root.pid(), tree.size());
        tree.forEach(ProcessHandle::destroy);

        awaitExit(tree, grace);

        // Anything spawned while we were waiting.
        if (root.isAlive()) {
            tree.addAll(snapshot(root));
        }
        List<ProcessHandle> survivors = tree.stream().filter(ProcessHandle::isAlive).toList();
        if (!survivors.isEmpty()) {
            log.info("Force killing {} process(es) of tree {} after {}s grace",
                    survivors.size(), root.pid(), grace.toSeconds());
            survivors.forEach(ProcessHandle::destroyForcibly);
            awaitExit(survivors, Duration.ofSeconds(2));
        }
        return tree.stream().noneMatch(ProcessHandle::isAlive);
    }

    /**
     * Returns the root followed by all of its live descendants.
     */
    public static Set<ProcessHandle> snapshot(ProcessHandle root) {
        var tree = new LinkedHashSet<ProcessHandle>();
        if (root.isAlive()) {
            tree.add(root);
        }
        root.descendants().filter(ProcessHandle::isAlive).forEach(tree::add);
        return tree;
    }

    private static void awaitExit(Iterable<ProcessHandle> handles, Duration timeout) {
        var exits = new ArrayList<CompletableFuture<ProcessHandle>>();
        for (ProcessHandle handle : handles) {
            exits.add(handle.onExit());
        }
        try {
            CompletableFuture.allOf(exits.toArray(new CompletableFuture<?>[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Processes still alive after {} ms", timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for processes to exit");
        } catch (ExecutionException e) {
            log.debug("Failed waiting for process exit: {}", e.getMessage());
        }
    }
}
