package io.laneboard.model;

import java.util.List;
import java.util.Map;

public record BoardStats(
        String board,
        int total,
        Map<String, Integer> byColumn,
        List<WipStatus> wip,
        Map<String, Integer> byPriority,
        Map<String, Integer> byAssignee
) {
    public record WipStatus(String column, int current, int limit, boolean atLimit, boolean exceeded) {
    }
}
