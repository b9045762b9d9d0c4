package io.archive.vectors;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Bounded collector keeping the k highest similarities seen.
 */
final class TopK {

    private final int k;
    private final PriorityQueue<Neighbor> heap;

    TopK(int k) {
        this.k = k;
        this.heap = new PriorityQueue<>(Math.max(1, k), Comparator.comparingDouble(Neighbor::score));
    }

    void offer(long id, float score) {
        if (k <= 0) {
            return;
        }
        if (heap.size() < k) {
            heap.add(new Neighbor(id, score));
        } else if (score > heap.peek().score()) {
            heap.poll();
            heap.add(new Neighbor(id, score));
        }
    }

    /**
     * Results ordered by similarity, best first. Ties keep the lower id first.
     */
    List<Neighbor> toList() {
        List<Neighbor> results = new ArrayList<>(heap);
        results.sort(Comparator.comparingDouble(Neighbor::score).reversed()
            .thenComparingLong(Neighbor::id));
        return results;
    }
}
