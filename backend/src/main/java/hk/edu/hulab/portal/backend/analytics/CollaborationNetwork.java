package hk.edu.hulab.portal.backend.analytics;

import java.util.List;

public record CollaborationNetwork(List<NetworkNode> nodes, List<NetworkEdge> edges) {

    public static CollaborationNetwork empty() {
        return new CollaborationNetwork(List.of(), List.of());
    }
}
