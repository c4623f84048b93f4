package com.team.qametrics.service.health;

import com.team.qametrics.config.TicketHealthConfig;
import com.team.qametrics.model.ticket.TicketStatusCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 將自由文字的 ticket 狀態解析為 TicketStatusCategory。
 * 狀態文字包含任一設定的結案標籤（不分大小寫）即為 CLOSED。
 */
@Component
public class TicketStatusResolver {

    private final List<String> closedLabels;

    public TicketStatusResolver(TicketHealthConfig config) {
        this.closedLabels = config.getClosedStatusLabels().stream()
                .filter(Objects::nonNull)
                .map(label -> label.trim().toLowerCase(Locale.ROOT))
                .filter(label -> !label.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    public TicketStatusCategory resolve(String status) {
        if (status == null || status.isBlank()) {
            return TicketStatusCategory.OPEN;
        }
        String normalized = status.toLowerCase(Locale.ROOT);
        for (String label : closedLabels) {
            if (normalized.contains(label)) {
                return TicketStatusCategory.CLOSED;
            }
        }
        return TicketStatusCategory.OPEN;
    }

    public boolean isClosed(String status) {
        return resolve(status) == TicketStatusCategory.CLOSED;
    }
}
