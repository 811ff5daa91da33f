package com.smartsense.core.lifecycle;

import com.smartsense.api.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 组件依赖图解析
 * <p>
 * 入参均为 "组件 ID -> 依赖的组件 ID" 的有序映射，迭代顺序即注册顺序
 */
public final class DependencyResolver {

    private DependencyResolver() {
    }

    /**
     * 查找依赖环，只考虑图内已存在的节点
     *
     * @return 环路径，首尾为同一节点，例如 [a, b, a]
     */
    public static Optional<List<String>> findCycle(Map<String, Set<String>> graph) {
        Map<String, Mark> marks = new HashMap<>();
        for (String node : graph.keySet()) {
            if (!marks.containsKey(node)) {
                List<String> path = new ArrayList<>();
                List<String> cycle = visit(node, graph, marks, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> visit(String node, Map<String, Set<String>> graph,
                                      Map<String, Mark> marks, List<String> path) {
        marks.put(node, Mark.VISITING);
        path.add(node);
        for (String dependency : graph.getOrDefault(node, Set.of())) {
            if (!graph.containsKey(dependency)) {
                continue; // 缺失依赖在 start() 时检查
            }
            Mark mark = marks.get(dependency);
            if (mark == Mark.VISITING) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                return cycle;
            }
            if (mark == null) {
                List<String> cycle = visit(dependency, graph, marks, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        marks.put(node, Mark.DONE);
        return null;
    }

    /**
     * 查找未注册的依赖
     *
     * @return 组件 ID -> 缺失的依赖 ID，没有缺失时为空
     */
    public static Map<String, Set<String>> findMissing(Map<String, Set<String>> graph) {
        Map<String, Set<String>> missing = new LinkedHashMap<>();
        graph.forEach((node, dependencies) -> {
            for (String dependency : dependencies) {
                if (!graph.containsKey(dependency)) {
                    missing.computeIfAbsent(node, k -> new LinkedHashSet<>()).add(dependency);
                }
            }
        });
        return missing;
    }

    /**
     * Kahn 算法分层：每层只依赖之前各层，层内保持注册顺序
     *
     * @throws ConfigurationException 存在缺失依赖或环
     */
    public static List<List<String>> resolveLayers(Map<String, Set<String>> graph) {
        Map<String, Set<String>> missing = findMissing(graph);
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing required components: " + missing);
        }

        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        graph.forEach((node, dependencies) -> {
            inDegree.put(node, new HashSet<>(dependencies).size());
            for (String dependency : new LinkedHashSet<>(dependencies)) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(node);
            }
        });

        List<List<String>> layers = new ArrayList<>();
        Set<String> resolved = new HashSet<>();
        List<String> current = new ArrayList<>();
        inDegree.forEach((node, degree) -> {
            if (degree == 0) {
                current.add(node);
            }
        });

        while (!current.isEmpty()) {
            layers.add(List.copyOf(current));
            resolved.addAll(current);
            Set<String> ready = new HashSet<>();
            for (String node : current) {
                for (String dependent : dependents.getOrDefault(node, List.of())) {
                    if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                        ready.add(dependent);
                    }
                }
            }
            current.clear();
            // 按注册顺序排列下一层
            for (String node : graph.keySet()) {
                if (ready.contains(node)) {
                    current.add(node);
                }
            }
        }

        if (resolved.size() != graph.size()) {
            List<String> cycle = findCycle(graph).orElse(List.of());
            throw new ConfigurationException("Dependency cycle detected: " + String.join(" -> ", cycle));
        }
        return layers;
    }

    private enum Mark {
        VISITING,
        DONE
    }
}
