package org.carball.designer.costmodel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.carball.designer.model.cost.CostBreakdown;
import org.carball.designer.model.cost.RankedDesign;
import org.carball.designer.model.design.Design;
import org.carball.designer.model.design.InvalidDesignException;
import org.carball.designer.stats.UnknownCollectionException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;

/**
 * Evaluates batches of candidate designs and orders them cheapest first.
 *
 * <p>Cancellation is cooperative: the supplier (and the thread's interrupt flag) is checked
 * before each evaluation, never during one. A cancelled batch returns whatever was
 * evaluated up to that point.
 */
@Slf4j
@RequiredArgsConstructor
public class DesignRanker {

    private static final Comparator<RankedDesign> BY_OVERALL_COST =
            Comparator.comparingDouble((RankedDesign r) -> r.cost().overall())
                    .thenComparingInt(RankedDesign::candidateIndex);

    private final CostModel costModel;

    public List<RankedDesign> rank(List<Design> designs) {
        return rank(designs, () -> false);
    }

    public List<RankedDesign> rank(List<Design> designs, BooleanSupplier cancelled) {
        List<RankedDesign> ranked = new ArrayList<>();
        for (int i = 0; i < designs.size(); i++) {
            if (isCancelled(cancelled)) {
                log.info("Ranking cancelled after {} of {} designs", i, designs.size());
                break;
            }
            evaluateCandidate(i, designs.get(i)).ifPresent(ranked::add);
        }
        ranked.sort(BY_OVERALL_COST);
        logBest(ranked);
        return ranked;
    }

    /**
     * Spreads the batch over a fixed pool of workers. The returned order is the same as {@link #rank}.
     */
    public List<RankedDesign> rankParallel(List<Design> designs, int workers, BooleanSupplier cancelled)
            throws InterruptedException {
        if (workers <= 0) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workers);
        }
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<CompletableFuture<Optional<RankedDesign>>> futures = new ArrayList<>(designs.size());
            for (int i = 0; i < designs.size(); i++) {
                final int candidateIndex = i;
                final Design design = designs.get(i);
                futures.add(CompletableFuture.supplyAsync(() -> isCancelled(cancelled)
                        ? Optional.<RankedDesign>empty()
                        : evaluateCandidate(candidateIndex, design), executor));
            }

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();

            List<RankedDesign> ranked = new ArrayList<>();
            for (CompletableFuture<Optional<RankedDesign>> future : futures) {
                future.get().ifPresent(ranked::add);
            }
            if (ranked.size() < designs.size()) {
                log.info("Evaluated {} of {} designs", ranked.size(), designs.size());
            }
            ranked.sort(BY_OVERALL_COST);
            logBest(ranked);
            return ranked;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Design evaluation failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private Optional<RankedDesign> evaluateCandidate(int candidateIndex, Design design) {
        try {
            CostBreakdown cost = costModel.evaluate(design);
            return Optional.of(new RankedDesign(candidateIndex, design, cost));
        } catch (InvalidDesignException | UnknownCollectionException e) {
            log.warn("Skipping design #{}: {}", candidateIndex, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isCancelled(BooleanSupplier cancelled) {
        return cancelled.getAsBoolean() || Thread.currentThread().isInterrupted();
    }

    private static void logBest(List<RankedDesign> ranked) {
        if (!ranked.isEmpty()) {
            RankedDesign best = ranked.get(0);
            log.info("Best of {} designs is #{}: {}", ranked.size(), best.candidateIndex(), best.cost().getSummary());
        }
    }
}
