package com.record.merge.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Compensating unit of work for a record merge.
 * Each completed step registers an undo action; if the transaction is closed without
 * {@link #markSuccess()}, the undo actions run in reverse order.
 *
 * <p>Usage:</p>
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction()) {
 *     var moved = tx.execute("re-parent associations",
 *             () -> migrator.migrate(type, duplicateId, masterId),
 *             m -> migrator.restore(type, m, duplicateId));
 *     tx.execute("delete duplicate", () -> records.delete(type, duplicateId),
 *             () -> records.save(duplicateSnapshot));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;
    private final Consumer<String> stepListener;
    private String failedStep;

    public MergeTransaction() {
        this(step -> { });
    }

    /**
     * @param stepListener told the description of every step that completes
     */
    public MergeTransaction(Consumer<String> stepListener) {
        this.stepListener = stepListener;
    }

    /**
     * Executes a step and registers its compensation.
     * If the step fails, every previously registered compensation runs in reverse order
     * and the exception is rethrown.
     *
     * @param description  human-readable description of the step
     * @param operation    the step to perform
     * @param compensation the action that reverses the step
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        execute(description, () -> {
            operation.run();
            return null;
        }, ignored -> compensation.run());
    }

    /**
     * Executes a step that produces a value; the compensation receives that value
     * so it can undo exactly what the step did.
     */
    public <T> T execute(String description, Supplier<T> operation, Consumer<T> compensation) {
        checkOpen();
        try {
            log.debug("Executing merge step: {}", description);
            T value = operation.get();
            compensationStack.push(new CompensatingAction(description, () -> compensation.accept(value)));
            stepListener.accept(description);
            return value;
        } catch (RuntimeException e) {
            failedStep = description;
            log.warn("Merge step '{}' failed: {}. Running compensations.", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Executes a step that has nothing to undo.
     */
    public void executeNoCompensation(String description, Runnable operation) {
        checkOpen();
        try {
            log.debug("Executing merge step (no compensation): {}", description);
            operation.run();
            stepListener.accept(description);
        } catch (RuntimeException e) {
            failedStep = description;
            log.warn("Merge step '{}' failed: {}. Running compensations.", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * Description of the step that threw, or null if none did.
     */
    public String getFailedStep() {
        return failedStep;
    }

    /**
     * Number of registered compensations not yet run.
     */
    public int pendingCompensations() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success) {
            if (!compensationStack.isEmpty()) {
                log.warn("MergeTransaction closed without success - running {} compensations",
                        compensationStack.size());
            }
            runCompensations();
        }
        closed = true;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("Running compensation: {}", action.description);
                action.compensation.run();
            } catch (Exception e) {
                // remaining compensations still run
                log.error("Compensation '{}' failed (best-effort): {}", action.description, e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {}
}
