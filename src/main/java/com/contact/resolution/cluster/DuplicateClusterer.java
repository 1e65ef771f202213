package com.contact.resolution.cluster;

import com.contact.resolution.core.model.DuplicateCluster;
import com.contact.resolution.core.model.MatchSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Groups match signals into clusters of transitively connected contacts.
 *
 * <p>Every signal connects each pair of its contact ids; the clusters are the connected
 * components of the resulting graph. If A matches B by email and B matches C by phone,
 * A, B and C form one cluster even though A and C never matched directly.</p>
 */
public class DuplicateClusterer {
    private static final Logger log = LoggerFactory.getLogger(DuplicateClusterer.class);

    /**
     * Computes the connected components of size two or more. Components are returned in
     * the order their first contact appears in the signals.
     */
    public List<DuplicateCluster> cluster(Collection<MatchSignal> signals) {
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (MatchSignal signal : signals) {
            List<String> ids = signal.contactIds();
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    addEdge(adjacency, ids.get(i), ids.get(j));
                }
            }
        }

        List<DuplicateCluster> clusters = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : adjacency.keySet()) {
            if (visited.contains(start)) {
                continue;
            }
            Set<String> component = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            visited.add(start);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                component.add(current);
                for (String neighbor : adjacency.get(current)) {
                    if (visited.add(neighbor)) {
                        queue.add(neighbor);
                    }
                }
            }
            if (component.size() > 1) {
                clusters.add(new DuplicateCluster(component));
            }
        }

        log.debug("cluster.completed signals={} contacts={} clusters={}",
                signals.size(), adjacency.size(), clusters.size());
        return clusters;
    }

    private static void addEdge(Map<String, Set<String>> adjacency, String a, String b) {
        adjacency.computeIfAbsent(a, k -> new LinkedHashSet<>()).add(b);
        adjacency.computeIfAbsent(b, k -> new LinkedHashSet<>()).add(a);
    }
}
