package com.automation.engine.persistence;

import com.automation.core.model.HierarchyNode;
import com.automation.core.model.NodeLevel;
import com.automation.core.model.NodeStatus;
import com.automation.core.repository.HierarchyRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of HierarchyRepository.
 */
public class InMemoryHierarchyRepository implements HierarchyRepository {

    private final Map<NodeKey, HierarchyNode> nodes = new ConcurrentHashMap<>();

    @Override
    public void save(HierarchyNode node) {
        nodes.put(new NodeKey(node.level(), node.id()), node);
    }

    @Override
    public Optional<HierarchyNode> findById(NodeLevel level, String id) {
        return Optional.ofNullable(nodes.get(new NodeKey(level, id)));
    }

    @Override
    public List<HierarchyNode> findChildren(NodeLevel level, String parentId) {
        return nodes.values().stream()
            .filter(n -> n.level() == level && parentId.equals(n.parentId()))
            .sorted(Comparator.comparingInt(HierarchyNode::position))
            .collect(Collectors.toList());
    }

    @Override
    public boolean compareAndSetStatus(NodeLevel level, String id, NodeStatus expected, NodeStatus next,
                                       Instant at, String actorId) {
        boolean[] changed = new boolean[1];
        nodes.computeIfPresent(new NodeKey(level, id), (key, node) -> {
            if (node.status() != expected) {
                return node;
            }
            changed[0] = true;
            return node.withStatus(next, at, actorId);
        });
        return changed[0];
    }

    private record NodeKey(NodeLevel level, String id) {}
}
